package io.intellixity.entigen.sql.ddl;

/** Forward and reverse migration text for one entity's table. */
public record Migration(String entity, String table, String up, String down) {}
