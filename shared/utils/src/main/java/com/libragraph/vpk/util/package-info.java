/**
 * Shared utilities for all VPK modules.
 *
 * <p>Contains {@link com.libragraph.vpk.util.KeyMaterial}, the directory lister used
 * to build archives from disk, the random code generator and the
 * {@link com.libragraph.vpk.util.VpkException} root of the error hierarchy.
 * No framework dependencies — pure Java.
 */
package com.libragraph.vpk.util;
