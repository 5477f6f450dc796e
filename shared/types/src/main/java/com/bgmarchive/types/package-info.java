/**
 * Pure Java value types shared across all archive modules.
 *
 * <p>Coded enumerations used by the wiki archive records. Every enum carries the
 * integer code that appears on the wire and a human readable label.
 * The entity records themselves live in {@code com.bgmarchive.types.entity}.
 * This module has no framework dependencies.
 */
package com.bgmarchive.types;
