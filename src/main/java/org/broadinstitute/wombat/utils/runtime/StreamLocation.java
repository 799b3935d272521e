package org.broadinstitute.wombat.utils.runtime;

/**
 * Where to write a captured process stream
 */
public enum StreamLocation {
    Buffer, File
}
