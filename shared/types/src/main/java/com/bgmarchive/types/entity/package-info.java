/**
 * Immutable records decoded from the archive member files.
 *
 * <p>Primary entities ({@link com.bgmarchive.types.entity.Subject},
 * {@link com.bgmarchive.types.entity.Person}, {@link com.bgmarchive.types.entity.Character},
 * {@link com.bgmarchive.types.entity.Episode}) and the relationship records linking them.
 * Foreign ids on relationship records are carried as-is; nothing here guarantees the
 * referenced entity exists.
 */
package com.bgmarchive.types.entity;
