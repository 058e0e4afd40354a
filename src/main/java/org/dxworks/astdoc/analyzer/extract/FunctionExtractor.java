package org.dxworks.astdoc.analyzer.extract;

import org.dxworks.astdoc.analyzer.KindClassifier;
import org.dxworks.astdoc.model.FunctionInfo;
import org.dxworks.astdoc.model.LocalVariable;
import org.dxworks.astdoc.model.ParameterInfo;
import org.dxworks.astdoc.model.SemanticKind;
import org.dxworks.astdoc.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.dxworks.astdoc.analyzer.SyntaxHelper.*;

/**
 * Free functions declared directly under the scanned node.
 * <p>
 * Calls and locals are read from the statements directly inside the function body, one level deep:
 * a call nested in a loop or closure is not reported. A call followed by {@code ?} or {@code .await} still counts.
 */
public class FunctionExtractor implements CategoryExtractor<FunctionInfo> {

    private static final String[] CALL_WRAPPERS = {"try_expression", "await_expression"};

    private final ExtractionContext context;

    public FunctionExtractor(ExtractionContext context) {
        this.context = context;
    }

    @Override
    public List<FunctionInfo> extract(SyntaxNode node) {
        List<FunctionInfo> functions = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (KindClassifier.is(child, SemanticKind.FUNCTION)) {
                analyzeFunction(node, child).ifPresent(functions::add);
            }
        }
        return functions;
    }

    private Optional<FunctionInfo> analyzeFunction(SyntaxNode container, SyntaxNode funcNode) {
        Optional<String> name = context.requiredFieldText(funcNode, "name", "function");
        if (name.isEmpty()) return Optional.empty();

        FunctionInfo function = new FunctionInfo();
        function.name = name.get();
        function.body = context.text(funcNode);
        function.returnType = context.fieldText(funcNode, "return_type").orElse(null);
        function.visibility = findFirstChild(funcNode, "visibility_modifier").map(context::text).orElse(null);
        function.attributes = context.attributes().leadingAttributes(container, funcNode);

        funcNode.childByField("parameters").ifPresent(params -> extractParameters(params, function));
        funcNode.childByField("body").ifPresent(body -> analyzeBody(body, function));
        return Optional.of(function);
    }

    private void extractParameters(SyntaxNode params, FunctionInfo function) {
        for (SyntaxNode param : params.namedChildren()) {
            if (param.isKind("parameter")) {
                extractParameter(param).ifPresent(function.parameters::add);
            } else if (param.isKind("self_parameter")) {
                ParameterInfo self = new ParameterInfo();
                self.name = "self";
                self.isReference = context.text(param).startsWith("&");
                self.isMutable = hasChild(param, "mutable_specifier");
                function.parameters.add(self);
            } else if (param.isKind("variadic_parameter")) {
                ParameterInfo variadic = new ParameterInfo();
                variadic.name = context.text(param);
                function.parameters.add(variadic);
            }
        }
    }

    private Optional<ParameterInfo> extractParameter(SyntaxNode param) {
        Optional<SyntaxNode> pattern = param.childByField("pattern");
        if (pattern.isEmpty()) {
            context.diagnostics().skipped("parameter", param, "no 'pattern' child");
            return Optional.empty();
        }

        ParameterInfo parameter = new ParameterInfo();
        SyntaxNode patternNode = pattern.get();
        parameter.isMutable = hasChild(param, "mutable_specifier");
        if (patternNode.isKind("mut_pattern")) {
            // `mut x` parsed as a pattern of its own in newer grammars
            parameter.isMutable = true;
            List<SyntaxNode> inner = patternNode.namedChildren();
            patternNode = inner.isEmpty() ? patternNode : inner.get(inner.size() - 1);
        }
        parameter.name = context.text(patternNode);

        Optional<SyntaxNode> type = param.childByField("type");
        parameter.type = type.map(context::text).orElse(null);
        parameter.isReference = type.map(t -> t.isKind("reference_type")).orElse(false);
        parameter.defaultValue = context.fieldText(param, "default_value").orElse(null);
        return Optional.of(parameter);
    }

    private void analyzeBody(SyntaxNode body, FunctionInfo function) {
        for (SyntaxNode statement : body.namedChildren()) {
            if (statement.isKind("let_declaration")) {
                extractLocalVariable(statement, function);
                statement.childByField("value").ifPresent(value -> collectCall(value, function));
            } else if (statement.isKind("expression_statement")) {
                findFirstChild(statement, "call_expression", "macro_invocation", "try_expression", "await_expression")
                        .ifPresent(call -> collectCall(call, function));
            } else {
                // trailing expression of the block
                collectCall(statement, function);
            }
        }
    }

    private void extractLocalVariable(SyntaxNode letDecl, FunctionInfo function) {
        Optional<String> name = context.requiredFieldText(letDecl, "pattern", "local variable");
        if (name.isEmpty()) return;

        LocalVariable variable = new LocalVariable();
        variable.name = name.get();
        variable.value = context.fieldText(letDecl, "value").orElse(null);
        variable.type = context.fieldText(letDecl, "type").orElse(null);
        function.localVariables.add(variable);
    }

    private void collectCall(SyntaxNode node, FunctionInfo function) {
        SyntaxNode expr = unwrap(node);
        if (expr.isKind("call_expression")) {
            Optional<String> target = context.requiredFieldText(expr, "function", "call");
            if (target.isEmpty()) return;
            Integer argumentCount = expr.childByField("arguments")
                    .map(args -> args.namedChildren().size())
                    .orElse(null);
            collectMethodCall(function, target.get(), argumentCount);
        } else if (expr.isKind("macro_invocation")) {
            Optional<String> macro = context.requiredFieldText(expr, "macro", "macro call");
            if (macro.isEmpty()) return;
            int argumentCount = findFirstChild(expr, "token_tree")
                    .map(tree -> countMacroArguments(context.text(tree)))
                    .orElse(0);
            collectMethodCall(function, macro.get() + "!", argumentCount);
        }
    }

    private static SyntaxNode unwrap(SyntaxNode expr) {
        SyntaxNode current = expr;
        while (current.isKind(CALL_WRAPPERS)) {
            List<SyntaxNode> inner = current.namedChildren();
            if (inner.isEmpty()) break;
            current = inner.get(0);
        }
        return current;
    }
}
