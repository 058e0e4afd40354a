package org.dxworks.astdoc.analyzer;

import org.dxworks.astdoc.model.FunctionInfo;
import org.dxworks.astdoc.model.MethodCall;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SyntaxHelper {

    private SyntaxHelper() {
    }

    public static Optional<SyntaxNode> findFirstChild(SyntaxNode parent, String... nodeTypes) {
        if (parent == null) return Optional.empty();
        for (SyntaxNode child : parent.namedChildren()) {
            if (child.isKind(nodeTypes)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public static List<SyntaxNode> findAllChildren(SyntaxNode parent, String... nodeTypes) {
        List<SyntaxNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (SyntaxNode child : parent.namedChildren()) {
            if (child.isKind(nodeTypes)) {
                result.add(child);
            }
        }
        return result;
    }

    public static boolean hasChild(SyntaxNode parent, String nodeType) {
        return findFirstChild(parent, nodeType).isPresent();
    }

    /**
     * Collects a call into the function, incrementing the count if the same call was already seen.
     */
    public static void collectMethodCall(FunctionInfo function, String name, Integer argumentCount) {
        for (MethodCall existingCall : function.calledMethods) {
            if (existingCall.matches(name, argumentCount)) {
                existingCall.callCount++;
                return;
            }
        }
        function.calledMethods.add(new MethodCall(name, argumentCount));
    }

    /**
     * Counts top-level comma separated arguments inside a macro token tree such as {@code ("{}", a.b(c, d))}.
     */
    public static int countMacroArguments(String tokenTreeText) {
        if (tokenTreeText == null || tokenTreeText.length() < 2) return 0;

        String content = tokenTreeText.substring(1, tokenTreeText.length() - 1).trim();
        if (content.isEmpty()) return 0;

        int count = 1;
        int depth = 0;
        boolean inString = false;
        char prevChar = ' ';

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);

            if (c == '"' && prevChar != '\\') {
                inString = !inString;
            } else if (!inString) {
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    count++;
                }
            }
            prevChar = c;
        }

        return count;
    }
}
