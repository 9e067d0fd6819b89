package com.libsl.loader.semantic;

import com.libsl.asg.Automaton;
import com.libsl.asg.Function;
import com.libsl.asg.GlobalVariableDeclaration;
import com.libsl.asg.Library;
import com.libsl.asg.LslContext;
import com.libsl.asg.SemanticException;
import com.libsl.asg.Variable;
import com.libsl.asg.type.Type;
import com.libsl.loader.LoaderMessage;
import com.libsl.loader.ast.AutomatonNode;
import com.libsl.loader.ast.FunctionNode;
import com.libsl.loader.ast.SourceLocation;
import com.libsl.loader.ast.TypeDeclarationNode;
import com.libsl.loader.ast.VariableNode;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** State shared by the two resolution passes over one library. */
final class AnalyzerState {
    final LslContext context = new LslContext();
    final List<LoaderMessage> messages = new ArrayList<>();
    final TypeResolver types = new TypeResolver(context);
    final ExpressionResolver expressions = new ExpressionResolver(context);
    Library library;

    // Only declarations that won their name are mapped; later duplicates are skipped by the second pass.
    final Map<TypeDeclarationNode, Type> typeDeclarations = new LinkedHashMap<>();
    final Map<AutomatonNode, Automaton> automata = new LinkedHashMap<>();
    final Map<VariableNode, GlobalVariableDeclaration> globals = new LinkedHashMap<>();
    final Map<VariableNode, Variable> automatonVariables = new IdentityHashMap<>();
    final Map<FunctionNode, Function> functions = new LinkedHashMap<>();

    void error(SourceLocation location, String message) {
        report(LoaderMessage.Level.ERROR, location, message);
    }

    void warning(SourceLocation location, String message) {
        report(LoaderMessage.Level.WARNING, location, message);
    }

    /** Records a failure of one declaration; {@code context} names the declaration, e.g. {@code function A.open}. */
    void error(String context, SourceLocation fallback, SemanticException ex) {
        SourceLocation location = fallback;
        if (ex instanceof ResolutionException resolution && resolution.getLocation() != null) {
            location = resolution.getLocation();
        }
        error(location, context + ": " + ex.getMessage());
    }

    private void report(LoaderMessage.Level level, SourceLocation location, String message) {
        messages.add(
                new LoaderMessage(
                        level,
                        message,
                        location == null ? "" : location.getSourceName(),
                        location == null ? 0 : location.getLine(),
                        location == null ? 0 : location.getColumn()));
    }

    boolean hasErrors() {
        return messages.stream().anyMatch(message -> message.getLevel() == LoaderMessage.Level.ERROR);
    }
}
