package work.leyline.ast;

public record CodeBlock(String lang, String text, int line, int column) implements CodeNode {
    public CodeBlock {
        lang = Nodes.text(lang, "lang");
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}
