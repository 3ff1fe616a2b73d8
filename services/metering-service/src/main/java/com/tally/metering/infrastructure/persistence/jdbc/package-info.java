/** PostgreSQL adapters over {@code NamedParameterJdbcTemplate}; schema lives in the database library. */
package com.tally.metering.infrastructure.persistence.jdbc;
