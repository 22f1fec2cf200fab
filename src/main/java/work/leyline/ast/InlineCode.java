package work.leyline.ast;

public record InlineCode(String lang, String text, int line, int column) implements CodeNode {
    public InlineCode {
        lang = Nodes.text(lang, "lang");
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInlineCode(this);
    }
}
