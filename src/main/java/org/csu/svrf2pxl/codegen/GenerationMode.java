package org.csu.svrf2pxl.codegen;

/**
 * What the generator does when the operation table has no template for a node.
 */
public enum GenerationMode {
    /** fail the whole generation with the first unmappable operation */
    STRICT,
    /** emit a marked placeholder comment and keep going */
    LENIENT
}
