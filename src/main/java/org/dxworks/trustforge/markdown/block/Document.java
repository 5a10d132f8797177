package org.dxworks.trustforge.markdown.block;

import java.util.List;

public record Document(List<Block> blocks) {
    public Document {
        blocks = List.copyOf(blocks);
    }

    public void accept(BlockVisitor visitor) {
        for (Block block : blocks) {
            block.accept(visitor);
        }
    }
}
