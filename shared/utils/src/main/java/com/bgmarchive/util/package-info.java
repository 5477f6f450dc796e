/**
 * Shared utilities for all archive modules.
 *
 * <p>Contains the {@link com.bgmarchive.util.io I/O helpers} used to split member files
 * into physical lines without losing the raw bytes of each line.
 * No framework dependencies.
 */
package com.bgmarchive.util;
