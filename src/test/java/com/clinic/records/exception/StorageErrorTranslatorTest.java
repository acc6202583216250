package com.clinic.records.exception;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class StorageErrorTranslatorTest {

    private final StorageErrorTranslator translator = new StorageErrorTranslator();

    @Test
    void rowPolicyViolationBecomesForbidden() {
        RuntimeException raw = new UncategorizedSQLException("insert", "insert into patients",
                new SQLException("new row violates row-level security policy", "42501"));

        RuntimeException translated = translator.translate("Register patient", raw);

        assertInstanceOf(ForbiddenException.class, translated);
        assertSame(raw, translated.getCause());
    }

    @Test
    void uniqueViolationBecomesSuppliedBusinessError() {
        RuntimeException raw = new DataIntegrityViolationException("dup",
                new SQLException("duplicate key value violates unique constraint", "23505"));

        RuntimeException translated = translator.translateWrite("Register patient", raw,
                () -> new DuplicateIdentityException("Patient already exists"));

        assertInstanceOf(DuplicateIdentityException.class, translated);
    }

    @Test
    void unrelatedFailuresPassThrough() {
        RuntimeException raw = new IllegalStateException("boom");

        assertSame(raw, translator.translate("Anything", raw));
        assertSame(raw, translator.translateWrite("Anything", raw, () -> new DuplicateIdentityException("dup")));
    }

    @Test
    void businessErrorsAreNeverRewrapped() {
        NotFoundException notFound = NotFoundException.of("Patient", "x");

        assertSame(notFound, translator.translate("Lookup", notFound));
    }

    @Test
    void sqlStateIsFoundInChainedExceptions() {
        SQLException outer = new SQLException("batch failed");
        outer.setNextException(new SQLException("inner", "23505"));

        assertEquals("23505", StorageErrorTranslator.sqlState(new RuntimeException(outer)).orElseThrow());
        assertTrue(StorageErrorTranslator.sqlState(new RuntimeException("no sql")).isEmpty());
    }
}
