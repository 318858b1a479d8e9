/**
 * JDBC access to the game archive tables.
 *
 * <p>One record per table row and one final helper class of static methods per table, each
 * taking the caller's {@link java.sql.Connection}. Helpers never open, commit or close
 * connections; transaction boundaries belong to the caller. Every method reports failures as a
 * {@link com.bezdurakov.common.status.StatusOr} instead of throwing.
 */
package com.bezdurakov.db;
