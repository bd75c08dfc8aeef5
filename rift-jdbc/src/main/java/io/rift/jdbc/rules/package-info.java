/**
 * Loading of reward rules from the database.
 */
package io.rift.jdbc.rules;
