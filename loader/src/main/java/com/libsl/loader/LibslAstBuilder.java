package com.libsl.loader;

import com.libsl.asg.ArithmeticBinaryOps;
import com.libsl.asg.ArithmeticUnaryOp;
import com.libsl.asg.ContractKind;
import com.libsl.asg.LslVersion;
import com.libsl.asg.StateKind;
import com.libsl.loader.ast.AccessNode;
import com.libsl.loader.ast.AccessSegmentNode;
import com.libsl.loader.ast.ActionNode;
import com.libsl.loader.ast.AnnotationNode;
import com.libsl.loader.ast.ArgumentNode;
import com.libsl.loader.ast.AssignmentNode;
import com.libsl.loader.ast.AutomatonNode;
import com.libsl.loader.ast.BinaryExpressionNode;
import com.libsl.loader.ast.ConstructorCallNode;
import com.libsl.loader.ast.ContractNode;
import com.libsl.loader.ast.DeclarationNode;
import com.libsl.loader.ast.EnumEntryNode;
import com.libsl.loader.ast.EnumLikeTypeNode;
import com.libsl.loader.ast.EnumTypeNode;
import com.libsl.loader.ast.ExpressionNode;
import com.libsl.loader.ast.FieldNode;
import com.libsl.loader.ast.FunctionNode;
import com.libsl.loader.ast.FunctionReferenceNode;
import com.libsl.loader.ast.HeaderNode;
import com.libsl.loader.ast.LibraryNode;
import com.libsl.loader.ast.LiteralNode;
import com.libsl.loader.ast.NamedArgumentNode;
import com.libsl.loader.ast.OldValueNode;
import com.libsl.loader.ast.ShiftNode;
import com.libsl.loader.ast.SimpleTypeNode;
import com.libsl.loader.ast.SourceLocation;
import com.libsl.loader.ast.StateNode;
import com.libsl.loader.ast.StatementNode;
import com.libsl.loader.ast.StructTypeNode;
import com.libsl.loader.ast.TypeAliasNode;
import com.libsl.loader.ast.TypeReferenceNode;
import com.libsl.loader.ast.UnaryExpressionNode;
import com.libsl.loader.ast.VariableNode;
import com.libsl.loader.grammar.LibSLBaseVisitor;
import com.libsl.loader.grammar.LibSLLexer;
import com.libsl.loader.grammar.LibSLParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.TerminalNode;

/** Parses LibSL source text into a {@link LibraryNode}. */
public final class LibslAstBuilder {

    public LibraryNode parse(String sourceName, String input) throws LibslParseException {
        CharStream stream = CharStreams.fromString(input, sourceName);
        return parse(sourceName, stream);
    }

    public LibraryNode parse(String sourceName, CharStream input) throws LibslParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        LibSLLexer lexer = new LibSLLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        if (DebugFlags.isTokenDebugEnabled()) {
            tokens.fill();
            DebugFlags.logTokens(tokens, lexer);
            tokens.seek(0);
        }

        LibSLParser parser = new LibSLParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener());
        }

        try {
            LibSLParser.FileContext context = parser.file();
            AstBuildingVisitor visitor = new AstBuildingVisitor(sourceName);
            return visitor.build(context);
        } catch (ParseCancellationException ex) {
            throw new LibslParseException(ex.getMessage(), ex);
        }
    }

    private static ParseCancellationException error(Token token, String message) {
        return new ParseCancellationException(
                "line " + token.getLine() + ":" + (token.getCharPositionInLine() + 1) + " " + message);
    }

    private static String unquote(Token token) {
        String text = token.getText();
        String body = text.substring(1, text.length() - 1);
        StringBuilder result = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                result.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n' -> result.append('\n');
                case 't' -> result.append('\t');
                case 'r' -> result.append('\r');
                default -> result.append(escaped);
            }
        }
        return result.toString();
    }

    private static final class AstBuildingVisitor extends LibSLBaseVisitor<Void> {
        private final String sourceName;
        private final ExpressionBuilder expressions;
        private final List<String> imports = new ArrayList<>();
        private final List<String> includes = new ArrayList<>();
        private final List<DeclarationNode> declarations = new ArrayList<>();

        AstBuildingVisitor(String sourceName) {
            this.sourceName = sourceName;
            this.expressions = new ExpressionBuilder(this);
        }

        LibraryNode build(LibSLParser.FileContext context) {
            HeaderNode header = header(context.header());
            for (LibSLParser.GlobalStatementContext statement : context.globalStatement()) {
                visit(statement);
            }
            return new LibraryNode(header, imports, includes, declarations);
        }

        SourceLocation location(Token token) {
            return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
        }

        SourceLocation location(ParserRuleContext ctx) {
            return location(ctx.getStart());
        }

        private HeaderNode header(LibSLParser.HeaderContext ctx) {
            LslVersion lslVersion = null;
            if (ctx.lslVersionText != null) {
                try {
                    lslVersion = LslVersion.parse(unquote(ctx.lslVersionText));
                } catch (IllegalArgumentException ex) {
                    throw error(ctx.lslVersionText, ex.getMessage());
                }
            }
            return new HeaderNode(
                    location(ctx),
                    ctx.name.getText(),
                    lslVersion,
                    optionalString(ctx.libraryVersionText),
                    optionalString(ctx.languageText),
                    optionalString(ctx.urlText));
        }

        private static String optionalString(Token token) {
            return token == null ? null : unquote(token);
        }

        @Override
        public Void visitImportStatement(LibSLParser.ImportStatementContext ctx) {
            imports.add(ctx.qualifiedName().getText());
            return null;
        }

        @Override
        public Void visitIncludeStatement(LibSLParser.IncludeStatementContext ctx) {
            includes.add(unquote(ctx.StringLiteral().getSymbol()));
            return null;
        }

        @Override
        public Void visitSimpleSemanticType(LibSLParser.SimpleSemanticTypeContext ctx) {
            declarations.add(new SimpleTypeNode(location(ctx), ctx.name.getText(), typeReference(ctx.typeReference())));
            return null;
        }

        @Override
        public Void visitEnumLikeSemanticType(LibSLParser.EnumLikeSemanticTypeContext ctx) {
            List<EnumEntryNode> entries = new ArrayList<>();
            for (LibSLParser.EnumLikeEntryContext entry : ctx.enumLikeEntry()) {
                entries.add(
                        new EnumEntryNode(
                                location(entry), entry.Identifier().getText(), signedLiteral(entry.signedLiteral())));
            }
            declarations.add(
                    new EnumLikeTypeNode(location(ctx), ctx.name.getText(), typeReference(ctx.typeReference()), entries));
            return null;
        }

        @Override
        public Void visitTypealiasStatement(LibSLParser.TypealiasStatementContext ctx) {
            declarations.add(new TypeAliasNode(location(ctx), ctx.name.getText(), typeReference(ctx.typeReference())));
            return null;
        }

        @Override
        public Void visitTypeDefBlock(LibSLParser.TypeDefBlockContext ctx) {
            List<FieldNode> fields = new ArrayList<>();
            for (LibSLParser.StructFieldContext field : ctx.structField()) {
                fields.add(
                        new FieldNode(location(field), field.Identifier().getText(), typeReference(field.typeReference())));
            }
            declarations.add(
                    new StructTypeNode(
                            location(ctx),
                            ctx.name.getText(),
                            ctx.generic == null ? null : typeReference(ctx.generic),
                            ctx.realType == null ? null : typeReference(ctx.realType),
                            fields));
            return null;
        }

        @Override
        public Void visitEnumBlock(LibSLParser.EnumBlockContext ctx) {
            List<EnumEntryNode> entries = new ArrayList<>();
            for (LibSLParser.EnumEntryContext entry : ctx.enumEntry()) {
                entries.add(
                        new EnumEntryNode(
                                location(entry), entry.Identifier().getText(), signedLiteral(entry.signedLiteral())));
            }
            declarations.add(new EnumTypeNode(location(ctx), ctx.name.getText(), entries));
            return null;
        }

        @Override
        public Void visitVariableDecl(LibSLParser.VariableDeclContext ctx) {
            declarations.add(variable(ctx));
            return null;
        }

        @Override
        public Void visitExtensionFunctionDecl(LibSLParser.ExtensionFunctionDeclContext ctx) {
            declarations.add(function(ctx, ctx.automatonName.getText(), true, ctx.name.getText(), ctx.functionRest()));
            return null;
        }

        @Override
        public Void visitAutomatonDecl(LibSLParser.AutomatonDeclContext ctx) {
            String name = ctx.name.getText();
            List<VariableNode> constructorVariables = new ArrayList<>();
            if (ctx.constructorVariables() != null) {
                for (LibSLParser.ConstructorVariableContext variable :
                        ctx.constructorVariables().constructorVariable()) {
                    constructorVariables.add(
                            new VariableNode(
                                    location(variable),
                                    variable.keyword.getText(),
                                    variable.name.getText(),
                                    typeReference(variable.typeReference()),
                                    variable.expression() == null ? null : expression(variable.expression())));
                }
            }
            List<StateNode> states = new ArrayList<>();
            List<ShiftNode> shifts = new ArrayList<>();
            List<VariableNode> variables = new ArrayList<>();
            List<FunctionNode> functions = new ArrayList<>();
            for (LibSLParser.AutomatonStatementContext statement : ctx.automatonStatement()) {
                if (statement.stateDecl() != null) {
                    states.addAll(states(statement.stateDecl()));
                } else if (statement.shiftDecl() != null) {
                    shifts.add(shift(statement.shiftDecl()));
                } else if (statement.variableDecl() != null) {
                    variables.add(variable(statement.variableDecl()));
                } else {
                    LibSLParser.FunctionDeclContext function = statement.functionDecl();
                    functions.add(function(function, name, false, function.name.getText(), function.functionRest()));
                }
            }
            declarations.add(
                    new AutomatonNode(
                            location(ctx),
                            name,
                            typeReference(ctx.typeReference()),
                            constructorVariables,
                            states,
                            shifts,
                            variables,
                            functions));
            return null;
        }

        private List<StateNode> states(LibSLParser.StateDeclContext ctx) {
            StateKind kind;
            try {
                kind = StateKind.fromString(ctx.kind.getText());
            } catch (IllegalArgumentException ex) {
                throw error(ctx.kind, ex.getMessage());
            }
            List<StateNode> states = new ArrayList<>();
            // Identifier() also returns the kind token at index 0
            List<TerminalNode> names = ctx.Identifier();
            for (TerminalNode name : names.subList(1, names.size())) {
                states.add(new StateNode(location(name.getSymbol()), name.getText(), kind));
            }
            return states;
        }

        private ShiftNode shift(LibSLParser.ShiftDeclContext ctx) {
            List<String> sources = new ArrayList<>();
            for (TerminalNode source : ctx.shiftSources().Identifier()) {
                sources.add(source.getText());
            }
            List<FunctionReferenceNode> functions = new ArrayList<>();
            if (ctx.functionsList() != null) {
                for (LibSLParser.FunctionsListPartContext part : ctx.functionsList().functionsListPart()) {
                    List<TypeReferenceNode> argumentTypes = null;
                    if (part.LPAR() != null) {
                        argumentTypes = new ArrayList<>();
                        for (LibSLParser.TypeReferenceContext type : part.typeReference()) {
                            argumentTypes.add(typeReference(type));
                        }
                    }
                    functions.add(new FunctionReferenceNode(location(part), part.name.getText(), argumentTypes));
                }
            }
            return new ShiftNode(location(ctx), sources, ctx.to.getText(), functions);
        }

        private VariableNode variable(LibSLParser.VariableDeclContext ctx) {
            return new VariableNode(
                    location(ctx),
                    ctx.keyword.getText(),
                    ctx.name.getText(),
                    typeReference(ctx.typeReference()),
                    ctx.expression() == null ? null : expression(ctx.expression()));
        }

        private FunctionNode function(
                ParserRuleContext ctx,
                String automatonName,
                boolean extension,
                String name,
                LibSLParser.FunctionRestContext rest) {
            List<ArgumentNode> arguments = new ArrayList<>();
            if (rest.functionArguments() != null) {
                for (LibSLParser.FunctionArgumentContext argument : rest.functionArguments().functionArgument()) {
                    arguments.add(
                            new ArgumentNode(
                                    location(argument),
                                    argument.name.getText(),
                                    typeReference(argument.typeReference()),
                                    argument.annotation() == null ? null : annotation(argument.annotation())));
                }
            }
            List<ContractNode> contracts = new ArrayList<>();
            for (LibSLParser.ContractContext contract : rest.contract()) {
                contracts.add(
                        new ContractNode(
                                location(contract),
                                contract.name == null ? null : contract.name.getText(),
                                contract.kind.getType() == LibSLLexer.REQUIRES ? ContractKind.REQUIRES : ContractKind.ENSURES,
                                expression(contract.expression())));
            }
            List<StatementNode> statements = new ArrayList<>();
            if (rest.functionBody() != null) {
                for (LibSLParser.FunctionBodyStatementContext statement : rest.functionBody().functionBodyStatement()) {
                    statements.add(statement(statement));
                }
            }
            return new FunctionNode(
                    location(ctx),
                    automatonName,
                    extension,
                    name,
                    arguments,
                    rest.returnType == null ? null : typeReference(rest.returnType),
                    rest.annotation() == null ? null : annotation(rest.annotation()),
                    contracts,
                    statements,
                    rest.functionBody() != null);
        }

        private StatementNode statement(LibSLParser.FunctionBodyStatementContext ctx) {
            if (ctx instanceof LibSLParser.AssignmentStatementContext assignment) {
                return new AssignmentNode(
                        location(assignment),
                        access(assignment.qualifiedAccess()),
                        expression(assignment.expression()));
            }
            LibSLParser.ActionStatementContext action = (LibSLParser.ActionStatementContext) ctx;
            return new ActionNode(location(action), action.name.getText(), expressions(action.expression()));
        }

        private AnnotationNode annotation(LibSLParser.AnnotationContext ctx) {
            return new AnnotationNode(location(ctx), ctx.name.getText(), expressions(ctx.expression()));
        }

        TypeReferenceNode typeReference(LibSLParser.TypeReferenceContext ctx) {
            List<String> nameParts = new ArrayList<>();
            for (TerminalNode part : ctx.qualifiedName().Identifier()) {
                nameParts.add(part.getText());
            }
            return new TypeReferenceNode(
                    location(ctx),
                    nameParts,
                    ctx.ASTERISK() != null,
                    ctx.typeReference() == null ? null : typeReference(ctx.typeReference()));
        }

        private LiteralNode signedLiteral(LibSLParser.SignedLiteralContext ctx) {
            return literal(ctx.literal(), ctx.MINUS() != null);
        }

        LiteralNode literal(LibSLParser.LiteralContext ctx, boolean negative) {
            Token token = ctx.getStart();
            Object value;
            switch (token.getType()) {
                case LibSLLexer.IntegerLiteral -> {
                    String text = (negative ? "-" : "") + token.getText();
                    try {
                        value = Integer.parseInt(text);
                    } catch (NumberFormatException ex) {
                        throw error(token, "integer literal out of range: " + text);
                    }
                }
                case LibSLLexer.FloatLiteral -> {
                    float parsed = Float.parseFloat(token.getText());
                    value = negative ? -parsed : parsed;
                }
                default -> {
                    if (negative) {
                        throw error(token, "unary minus on non-numeric literal " + token.getText());
                    }
                    value = switch (token.getType()) {
                        case LibSLLexer.StringLiteral -> unquote(token);
                        case LibSLLexer.TRUE -> Boolean.TRUE;
                        default -> Boolean.FALSE;
                    };
                }
            }
            return new LiteralNode(location(token), value);
        }

        ExpressionNode expression(LibSLParser.ExpressionContext ctx) {
            return expressions.visit(ctx);
        }

        List<ExpressionNode> expressions(List<LibSLParser.ExpressionContext> contexts) {
            List<ExpressionNode> result = new ArrayList<>(contexts.size());
            for (LibSLParser.ExpressionContext context : contexts) {
                result.add(expression(context));
            }
            return result;
        }

        AccessNode access(LibSLParser.QualifiedAccessContext ctx) {
            String head;
            String getterArgument = null;
            if (ctx.accessHead() instanceof LibSLParser.AutomatonGetterHeadContext getter) {
                head = getter.automatonName.getText();
                getterArgument = getter.argumentName.getText();
            } else {
                head = ((LibSLParser.IdentifierHeadContext) ctx.accessHead()).Identifier().getText();
            }
            List<AccessSegmentNode> segments = new ArrayList<>();
            for (LibSLParser.AccessSegmentContext segment : ctx.accessSegment()) {
                if (segment instanceof LibSLParser.FieldSegmentContext field) {
                    segments.add(AccessSegmentNode.field(location(field), field.Identifier().getText()));
                } else {
                    LibSLParser.IndexSegmentContext index = (LibSLParser.IndexSegmentContext) segment;
                    segments.add(AccessSegmentNode.index(location(index), expression(index.expression())));
                }
            }
            return new AccessNode(location(ctx), head, getterArgument, segments);
        }
    }

    private static final class ExpressionBuilder extends LibSLBaseVisitor<ExpressionNode> {
        private final AstBuildingVisitor owner;

        ExpressionBuilder(AstBuildingVisitor owner) {
            this.owner = owner;
        }

        @Override
        public ExpressionNode visitParenthesizedExpression(LibSLParser.ParenthesizedExpressionContext ctx) {
            return visit(ctx.expression());
        }

        @Override
        public ExpressionNode visitUnaryOpExpression(LibSLParser.UnaryOpExpressionContext ctx) {
            // -1 is kept as a literal, not as a negation
            if (ctx.op.getType() == LibSLLexer.MINUS
                    && ctx.expression() instanceof LibSLParser.LiteralExpressionContext literal
                    && literal.literal().getStart().getType() != LibSLLexer.StringLiteral
                    && literal.literal().getStart().getType() != LibSLLexer.TRUE
                    && literal.literal().getStart().getType() != LibSLLexer.FALSE) {
                return owner.literal(literal.literal(), true);
            }
            return new UnaryExpressionNode(
                    owner.location(ctx), ArithmeticUnaryOp.fromString(ctx.op.getText()), visit(ctx.expression()));
        }

        @Override
        public ExpressionNode visitBinaryOpExpression(LibSLParser.BinaryOpExpressionContext ctx) {
            return new BinaryExpressionNode(
                    owner.location(ctx),
                    ArithmeticBinaryOps.fromString(ctx.op.getText()),
                    visit(ctx.expression(0)),
                    visit(ctx.expression(1)));
        }

        @Override
        public ExpressionNode visitOldValueExpression(LibSLParser.OldValueExpressionContext ctx) {
            return new OldValueNode(owner.location(ctx), owner.access(ctx.qualifiedAccess()));
        }

        @Override
        public ExpressionNode visitConstructorCallExpression(LibSLParser.ConstructorCallExpressionContext ctx) {
            List<NamedArgumentNode> arguments = new ArrayList<>();
            for (LibSLParser.NamedArgumentContext argument : ctx.namedArgument()) {
                arguments.add(
                        new NamedArgumentNode(
                                owner.location(argument), argument.name.getText(), visit(argument.expression())));
            }
            return new ConstructorCallNode(owner.location(ctx), ctx.automatonName.getText(), arguments);
        }

        @Override
        public ExpressionNode visitAccessExpression(LibSLParser.AccessExpressionContext ctx) {
            return owner.access(ctx.qualifiedAccess());
        }

        @Override
        public ExpressionNode visitLiteralExpression(LibSLParser.LiteralExpressionContext ctx) {
            return owner.literal(ctx.literal(), false);
        }
    }
}
