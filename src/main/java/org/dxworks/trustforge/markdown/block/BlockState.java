package org.dxworks.trustforge.markdown.block;

/**
 * The block the scanner is currently inside. Exactly one is active on any line.
 */
public enum BlockState {
    NONE,
    PARAGRAPH,
    BULLET_LIST,
    ORDERED_LIST,
    CODE_BLOCK,
    BLOCKQUOTE,
    TABLE_CAPTURE
}
