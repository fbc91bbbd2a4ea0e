package com.modelforge.generator.codegen.template;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

import com.modelforge.generator.codegen.template.ast.EachNode;
import com.modelforge.generator.codegen.template.ast.IfNode;
import com.modelforge.generator.codegen.template.ast.LiteralNode;
import com.modelforge.generator.codegen.template.ast.PathNode;
import com.modelforge.generator.codegen.template.ast.TemplateNode;
import com.modelforge.generator.codegen.template.ast.VariableNode;

/**
 * Turns template text into a node tree.
 *
 * Tags are {@code {{name}}}, {@code {{a.b}}}, {@code {{#if x}}}, {@code {{/if}}}, {@code {{#each x}}} and
 * {@code {{/each}}}. Any other {@code {{...}}} sequence is kept as literal text.
 */
final class TemplateParser {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private static final Pattern NAME = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern PATH = Pattern.compile("[A-Za-z_]\\w*(\\.\\w+)+");

    private TemplateParser() {
    }

    static List<TemplateNode> parse(String templateName, String text) {
        Deque<Frame> stack = new ArrayDeque<>();
        Frame root = new Frame(null, null);
        stack.push(root);

        int position = 0;
        while (position < text.length()) {
            int start = text.indexOf(OPEN, position);
            if (start < 0) {
                stack.peek().children.add(new LiteralNode(text.substring(position)));
                break;
            }
            int end = text.indexOf(CLOSE, start + OPEN.length());
            if (end < 0) {
                stack.peek().children.add(new LiteralNode(text.substring(position)));
                break;
            }
            if (start > position) {
                stack.peek().children.add(new LiteralNode(text.substring(position, start)));
            }

            String source = text.substring(start, end + CLOSE.length());
            String tag = text.substring(start + OPEN.length(), end).trim();
            handleTag(templateName, tag, source, stack);
            position = end + CLOSE.length();
        }

        if (stack.size() > 1) {
            throw new TemplateSyntaxException(templateName,
                    "unclosed {{#" + stack.peek().keyword + " " + stack.peek().expression + "}}");
        }
        return mergeLiterals(root.children);
    }

    private static void handleTag(String templateName, String tag, String source, Deque<Frame> stack) {
        if (tag.startsWith("#if ") || tag.startsWith("#each ")) {
            String keyword = tag.substring(1, tag.indexOf(' '));
            String expression = tag.substring(tag.indexOf(' ') + 1).trim();
            if (!NAME.matcher(expression).matches() && !PATH.matcher(expression).matches()) {
                throw new TemplateSyntaxException(templateName,
                        "invalid expression '" + expression + "' in " + source);
            }
            stack.push(new Frame(keyword, expression));
        } else if (tag.equals("/if") || tag.equals("/each")) {
            String keyword = tag.substring(1);
            Frame frame = stack.peek();
            if (frame.keyword == null) {
                throw new TemplateSyntaxException(templateName, "unexpected " + source);
            }
            if (!frame.keyword.equals(keyword)) {
                throw new TemplateSyntaxException(templateName,
                        "expected {{/" + frame.keyword + "}} but found " + source);
            }
            stack.pop();
            List<TemplateNode> body = mergeLiterals(frame.children);
            TemplateNode block = "if".equals(keyword)
                    ? new IfNode(frame.expression, body)
                    : new EachNode(frame.expression, body);
            stack.peek().children.add(block);
        } else if (NAME.matcher(tag).matches()) {
            stack.peek().children.add(new VariableNode(tag, source));
        } else if (PATH.matcher(tag).matches()) {
            stack.peek().children.add(new PathNode(tag, source));
        } else {
            stack.peek().children.add(new LiteralNode(source));
        }
    }

    private static List<TemplateNode> mergeLiterals(List<TemplateNode> nodes) {
        List<TemplateNode> merged = new ArrayList<>();
        for (TemplateNode node : nodes) {
            int last = merged.size() - 1;
            if (node instanceof LiteralNode literal && last >= 0 && merged.get(last) instanceof LiteralNode previous) {
                merged.set(last, new LiteralNode(previous.text() + literal.text()));
            } else {
                merged.add(node);
            }
        }
        return merged;
    }

    private static final class Frame {
        private final String keyword;
        private final String expression;
        private final List<TemplateNode> children = new ArrayList<>();

        private Frame(String keyword, String expression) {
            this.keyword = keyword;
            this.expression = expression;
        }
    }
}
