package work.leyline.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Type-directed traversal of the document tree.
 *
 * <p>Every {@code visitX} method defaults to the handler of its category, so a visitor only
 * overrides the variants it cares about: formatting spans fall back to
 * {@link #visitFormatting(Formatting)} then {@link #visitContainer(Container)}, code nodes to
 * {@link #visitCode(CodeNode)} then {@link #visitText(TextNode)}. Anything left unhandled ends in
 * {@link #visitNode(Node)}, which fails with a {@link DispatchException} naming the node and the
 * visitor.
 *
 * @param <R> result of visiting one node
 */
public interface NodeVisitor<R> {
    default R visit(Node node) {
        return node.accept(this);
    }

    /** Visits {@code nodes} in order. */
    default List<R> visitAll(List<? extends Node> nodes) {
        List<R> results = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            results.add(node.accept(this));
        }
        return results;
    }

    default R visitNode(Node node) {
        throw new DispatchException(node, this);
    }

    default R visitContainer(Container node) {
        return visitNode(node);
    }

    default R visitFormatting(Formatting node) {
        return visitContainer(node);
    }

    default R visitText(TextNode node) {
        return visitNode(node);
    }

    default R visitCode(CodeNode node) {
        return visitText(node);
    }

    default R visitDocument(Document node) {
        return visitContainer(node);
    }

    default R visitTextBlock(TextBlock node) {
        return visitContainer(node);
    }

    default R visitPlainText(PlainText node) {
        return visitText(node);
    }

    default R visitComment(Comment node) {
        return visitText(node);
    }

    default R visitCodeBlock(CodeBlock node) {
        return visitCode(node);
    }

    default R visitInlineCode(InlineCode node) {
        return visitCode(node);
    }

    default R visitEquation(Equation node) {
        return visitText(node);
    }

    default R visitInlineMath(InlineMath node) {
        return visitText(node);
    }

    default R visitBold(Bold node) {
        return visitFormatting(node);
    }

    default R visitItalics(Italics node) {
        return visitFormatting(node);
    }

    default R visitUnderline(Underline node) {
        return visitFormatting(node);
    }

    default R visitStrikethrough(Strikethrough node) {
        return visitFormatting(node);
    }

    default R visitSubscript(Subscript node) {
        return visitFormatting(node);
    }

    default R visitSuperscript(Superscript node) {
        return visitFormatting(node);
    }

    default R visitListBlock(ListBlock node) {
        return visitNode(node);
    }

    default R visitTable(Table node) {
        return visitNode(node);
    }

    default R visitFigure(Figure node) {
        return visitNode(node);
    }

    default R visitRenderFor(RenderFor node) {
        return visitContainer(node);
    }

    default R visitWith(With node) {
        return visitText(node);
    }

    default R visitCorporealMacro(CorporealMacro node) {
        return visitContainer(node);
    }

    default R visitIncorporealMacro(IncorporealMacro node) {
        return visitText(node);
    }
}
