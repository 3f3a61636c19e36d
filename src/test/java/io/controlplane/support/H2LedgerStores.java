package io.controlplane.support;

import io.controlplane.store.JdbcLedgerStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;

/**
 * Fresh in-memory H2 databases holding an initialized ledger schema.
 */
public final class H2LedgerStores {

    private H2LedgerStores() {
    }

    public static EmbeddedDatabase newDatabase() {
        return new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .build();
    }

    public static JdbcLedgerStore newStore(EmbeddedDatabase database, Clock clock) {
        JdbcLedgerStore store = new JdbcLedgerStore(new JdbcTemplate(database), clock);
        store.initialize();
        return store;
    }
}
