package uk.gegc.creditledger;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.creditledger.features.billing.testutils.LedgerFixtures;

/**
 * Base class for ledger integration tests.
 *
 * Tests are not wrapped in a transaction: every ledger operation commits its own transaction
 * and the usage aggregation runs on commit, so rollback-per-test would hide exactly what is under test.
 * Isolation comes from each test creating its own plan and workspace.
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
    protected LedgerFixtures fixtures;

    @Autowired
    protected JdbcTemplate jdbcTemplate;
}
