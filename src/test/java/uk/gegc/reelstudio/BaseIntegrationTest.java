package uk.gegc.reelstudio;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

/**
 * Base class for integration tests against the in-memory database.
 *
 * Not transactional: the code under test commits its own transactions (including REQUIRES_NEW ones), so
 * subclasses clean up with {@link #clearTables()} instead of relying on rollback.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@TestPropertySource(properties = {
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.flyway.enabled=false"
})
public abstract class BaseIntegrationTest {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    protected void clearTables() {
        jdbcTemplate.update("DELETE FROM token_transactions");
        jdbcTemplate.update("DELETE FROM video_segments");
        jdbcTemplate.update("DELETE FROM works");
        jdbcTemplate.update("DELETE FROM balances");
    }
}
