package work.leyline.api;

import java.util.ArrayList;
import java.util.List;
import work.leyline.ast.Container;
import work.leyline.ast.Figure;
import work.leyline.ast.ListBlock;
import work.leyline.ast.Node;
import work.leyline.ast.Table;
import work.leyline.ast.TextNode;
import work.leyline.context.ContextVisitor;
import work.leyline.context.Environments;
import work.leyline.context.ScriptEvaluator;

/**
 * Walks the whole tree for its side effects on environments and gathers the value of every macro
 * it resolves, in document order.
 */
final class EvaluatingVisitor extends ContextVisitor<List<Object>> {
    EvaluatingVisitor(ScriptEvaluator evaluator, Environments environments, String defaultContext, String target) {
        super(evaluator, environments, defaultContext, target);
    }

    @Override
    protected List<Object> fromValue(Object value) {
        List<Object> values = new ArrayList<>(1);
        values.add(value);
        return values;
    }

    @Override
    protected List<Object> concat(List<List<Object>> parts) {
        List<Object> values = new ArrayList<>();
        parts.forEach(values::addAll);
        return values;
    }

    @Override
    public List<Object> visitContainer(Container node) {
        return concat(visitAll(node.body()));
    }

    @Override
    public List<Object> visitText(TextNode node) {
        return concat(List.of());
    }

    @Override
    public List<Object> visitListBlock(ListBlock node) {
        List<List<Object>> parts = new ArrayList<>();
        for (List<Node> item : node.items()) {
            parts.addAll(visitAll(item));
        }
        return concat(parts);
    }

    @Override
    public List<Object> visitTable(Table node) {
        List<List<Object>> parts = new ArrayList<>();
        for (List<List<Node>> row : node.rows()) {
            for (List<Node> cell : row) {
                parts.addAll(visitAll(cell));
            }
        }
        return concat(parts);
    }

    @Override
    public List<Object> visitFigure(Figure node) {
        return concat(visitAll(node.caption()));
    }
}
