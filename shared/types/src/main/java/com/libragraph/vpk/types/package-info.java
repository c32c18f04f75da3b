/**
 * Pure Java value types shared across all VPK modules.
 *
 * <p>Holds the closed enumerations for encryption and compression modes whose
 * labels end up in the archive header. No framework dependencies.
 */
package com.libragraph.vpk.types;
