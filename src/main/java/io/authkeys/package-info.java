/**
 * authkeys source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.authkeys.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.authkeys.cli.AuthKeysCommand} maps commands to runtime operations.</li>
 *   <li>{@code io.authkeys.runtime.AuditRuntime} runs the fetch, classify and remediate phases.</li>
 *   <li>{@code io.authkeys.credential.CredentialBroker} owns authentication and the secret cache.</li>
 * </ul>
 */
package io.authkeys;
