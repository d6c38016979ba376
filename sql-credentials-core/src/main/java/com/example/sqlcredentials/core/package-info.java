/**
 * Root package for the sql-credentials library.
 *
 * <p>This package contains a small set of focused classes that create, revoke and rotate database
 * accounts from administrator-supplied SQL templates, on a single database target, under a
 * transaction and an exclusive lock.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.sqlcredentials.core.SqlCredentialManager} – the lifecycle operations
 *       and the exclusivity guard.
 *   <li>{@link com.example.sqlcredentials.core.credentials.SqlCredentialGenerator} – usernames,
 *       passwords and expiration literals under a {@link
 *       com.example.sqlcredentials.core.credentials.UsernamePolicy UsernamePolicy}.
 *   <li>{@link com.example.sqlcredentials.core.template.StatementTemplate} – statement splitting
 *       and placeholder substitution.
 *   <li>{@link com.example.sqlcredentials.core.jdbc.TransactionalExecutor} – batch execution in one
 *       transaction, with prepared-statement fallback.
 *   <li>{@link com.example.sqlcredentials.core.jdbc.ConnectionProducer} – the live data source for
 *       the target.
 *   <li>{@link com.example.sqlcredentials.core.config.ConnectionSettings} – settings map decoding.
 *   <li>{@link com.example.sqlcredentials.core.secrets.SecretSettings} – settings read from AWS
 *       Secrets Manager.
 * </ul>
 */
package com.example.sqlcredentials.core;
