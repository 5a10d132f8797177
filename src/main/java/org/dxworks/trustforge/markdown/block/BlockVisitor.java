package org.dxworks.trustforge.markdown.block;

public interface BlockVisitor {
    void visit(Block.Paragraph paragraph);

    void visit(Block.Heading heading);

    void visit(Block.BulletList list);

    void visit(Block.OrderedList list);

    void visit(Block.CodeBlock codeBlock);

    void visit(Block.Blockquote blockquote);

    void visit(Block.Table table);

    void visit(Block.Rule rule);
}
