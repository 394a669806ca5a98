/**
 * Shared utilities for all content-store modules.
 *
 * <p>Contains {@link com.libragraph.contentstore.util.ContentHash} (SHA-256),
 * {@link com.libragraph.contentstore.util.ContentId}, the
 * {@link com.libragraph.contentstore.util.AssetNamer} and the
 * {@link com.libragraph.contentstore.util.buffer buffer layer} (BinaryData, Buffer, RamBuffer, FileBuffer).
 * No framework dependencies beyond commons-codec.
 */
package com.libragraph.contentstore.util;
