package com.libsl.loader.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.libsl.asg.AccessAlias;
import com.libsl.asg.Annotation;
import com.libsl.asg.ArithmeticBinaryOps;
import com.libsl.asg.ArrayAccess;
import com.libsl.asg.Assignment;
import com.libsl.asg.Automaton;
import com.libsl.asg.BinaryOpExpression;
import com.libsl.asg.CallAutomatonConstructor;
import com.libsl.asg.Contract;
import com.libsl.asg.ContractKind;
import com.libsl.asg.Function;
import com.libsl.asg.IntegerLiteral;
import com.libsl.asg.Library;
import com.libsl.asg.OldValue;
import com.libsl.asg.QualifiedAccess;
import com.libsl.asg.RealTypeAccess;
import com.libsl.asg.ResultVariable;
import com.libsl.asg.Variable;
import com.libsl.asg.VariableAccess;
import com.libsl.asg.type.ChildrenType;
import com.libsl.asg.type.EnumType;
import com.libsl.loader.LoaderException;
import com.libsl.loader.LoaderMessage;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SemanticAnalyzerTest {

    @Test
    void resolvesForwardReferencesRegardlessOfDeclarationOrder() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library fwd;",
                        "fun B.touch() { x = 1; }",
                        "automaton A : Int { var b: B; initstate S; }",
                        "automaton B : Int { var x: Int = 0; initstate S; }",
                        "types { Int(int32); }");

        assertEquals(List.of(), errors(analysis));
        Library library = analysis.getLibrary().orElseThrow();
        Automaton a = library.getAutomata().get(0);
        Automaton b = library.getAutomata().get(1);

        Function touch = b.getFunctions().get(0);
        assertEquals("touch", touch.getName());
        assertSame(b, touch.getAutomaton());
        assertSame(b, touch.getTarget());
        assertEquals("B.touch", touch.getQualifiedName());
        assertSame(b.getType(), a.findVariable("b").orElseThrow().getType());

        Assignment assignment = assertInstanceOf(Assignment.class, touch.getStatements().get(0));
        VariableAccess x = assertInstanceOf(VariableAccess.class, assignment.getLeft());
        assertSame(b.findVariable("x").orElseThrow(), x.getVariable());
    }

    @Test
    void unresolvedAutomatonIsReportedAgainstTheFunction() throws Exception {
        SemanticAnalysis analysis = analyze("library t;", "fun Missing.f();");

        assertEquals(List.of("function Missing.f: unresolved automaton 'Missing'"), errors(analysis));
        assertTrue(analysis.getLibrary().isEmpty());
        LoaderMessage error = analysis.getMessages().get(0);
        assertEquals("test.lsl", error.getSourceFilename());
        assertEquals(2, error.getSourceLineno());
        assertEquals(1, error.getSourceColumn());
    }

    @Test
    void resolvesAccessChainThroughStructureAndArray() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library q;",
                        "types { Int(int32); }",
                        "type Inner { c: Int; }",
                        "type Outer { b: array<Inner>; }",
                        "automaton A : Int {",
                        "    var a: Outer;",
                        "    fun f(): Int { result = a.b[0].c; }",
                        "}");

        assertEquals(List.of(), errors(analysis));
        Function f = analysis.getLibrary().orElseThrow().getAutomata().get(0).getLocalFunctions().get(0);
        Assignment assignment = assertInstanceOf(Assignment.class, f.getStatements().get(0));

        VariableAccess result = assertInstanceOf(VariableAccess.class, assignment.getLeft());
        assertInstanceOf(ResultVariable.class, result.getVariable());

        VariableAccess a = assertInstanceOf(VariableAccess.class, assignment.getValue());
        assertEquals("Outer", a.getType().getName());
        VariableAccess b = assertInstanceOf(VariableAccess.class, a.getChildAccess());
        assertTrue(b.getType().isArray());
        ArrayAccess index = assertInstanceOf(ArrayAccess.class, b.getChildAccess());
        assertEquals(0, assertInstanceOf(IntegerLiteral.class, index.getIndex()).getValue());
        assertEquals("Inner", index.getType().getName());
        QualifiedAccess last = a.getLastChild();
        assertEquals("c", assertInstanceOf(VariableAccess.class, last).getFieldName());
        assertEquals("Int", last.getType().getFullName());
    }

    @Test
    void indexOnNonArrayFailsTheFunction() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library q;",
                        "types { Int(int32); }",
                        "type Inner { c: Int; }",
                        "type Outer { b: Inner; }",
                        "automaton A : Int {",
                        "    var a: Outer;",
                        "    fun f(): Int { result = a.b[0].c; }",
                        "}");

        assertEquals(List.of("function A.f: index on non-array type 'Inner'"), errors(analysis));
    }

    @Test
    void unknownFieldNamesTheSegment() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library q;",
                        "types { Int(int32); }",
                        "type Point { x: Int; }",
                        "automaton A : Int { var p: Point; fun f() { p.z = 1; } }");

        assertEquals(List.of("function A.f: unresolved field 'z' in type 'Point'"), errors(analysis));
    }

    @Test
    void aliasesAreUnwrappedForFieldAccess() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library q;",
                        "types { Int(int32); }",
                        "type Point { x: Int; }",
                        "typealias P = Point;",
                        "typealias Q = P;",
                        "automaton A : Int { var q: Q; fun f() { q.x = 1; } }");

        assertEquals(List.of(), errors(analysis));
        Function f = analysis.getLibrary().orElseThrow().getAutomata().get(0).getLocalFunctions().get(0);
        Assignment assignment = assertInstanceOf(Assignment.class, f.getStatements().get(0));
        assertEquals("Int", assignment.getLeft().getLastChild().getType().getName());
    }

    @Test
    void resolvesConstructorCall() throws Exception {
        SemanticAnalysis analysis = analyze(constructorSpec("new B(state = s2, v = 0)"));

        assertEquals(List.of(), errors(analysis));
        Library library = analysis.getLibrary().orElseThrow();
        Automaton b = library.getAutomata().get(0);
        Function make = library.getAutomata().get(1).getLocalFunctions().get(0);
        Assignment assignment = assertInstanceOf(Assignment.class, make.getStatements().get(0));
        CallAutomatonConstructor call = assertInstanceOf(CallAutomatonConstructor.class, assignment.getValue());

        assertSame(b, call.getAutomaton());
        assertSame(b.findState("s2").orElseThrow(), call.getState());
        assertEquals(1, call.getArgs().size());
        assertSame(b.findVariable("v").orElseThrow(), call.getArgs().get(0).getVariable());
        assertSame(call, call.getArgs().get(0).getInit().getParent());
    }

    @Test
    void constructorCallWithUnknownStateIsAnError() throws Exception {
        SemanticAnalysis analysis = analyze(constructorSpec("new B(state = s9, v = 0)"));

        assertEquals(List.of("function A.make: unresolved state 's9' in automaton 'B'"), errors(analysis));
    }

    @Test
    void constructorCallWithoutStateIsAnError() throws Exception {
        SemanticAnalysis analysis = analyze(constructorSpec("new B(v = 0)"));

        assertEquals(List.of("function A.make: constructor of 'B' requires a 'state' argument"), errors(analysis));
    }

    @Test
    void constructorCallWithUnknownArgumentIsAnError() throws Exception {
        SemanticAnalysis analysis = analyze(constructorSpec("new B(state = s1, nope = 0)"));

        assertEquals(List.of("function A.make: unresolved argument 'nope' in constructor of 'B'"), errors(analysis));
    }

    @Test
    void constructorCallCannotBindInternalVariable() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library c;",
                        "types { Int(int32); }",
                        "automaton B (var v: Int) : Int { var count: Int = 0; initstate s1; }",
                        "automaton A : Int { var child: B; fun make() { child = new B(state = s1, count = 5); } }");

        assertEquals(List.of("function A.make: unresolved argument 'count' in constructor of 'B'"), errors(analysis));
    }

    private static String[] constructorSpec(String call) {
        return new String[] {
            "library c;",
            "types { Int(int32); }",
            "automaton B (var v: Int) : Int { initstate s1; state s2; }",
            "automaton A : Int { var child: B; fun make() { child = " + call + "; } }"
        };
    }

    @Test
    void resolvesContractsWithOldValueAndResult() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library c;",
                        "types { Int(int32); }",
                        "automaton A : Int {",
                        "    var count: Int = 0;",
                        "    fun inc(): Int",
                        "        requires nonNegative: count >= 0;",
                        "        ensures result = old(count) + 1;",
                        "}");

        assertEquals(List.of(), errors(analysis));
        Function inc = analysis.getLibrary().orElseThrow().getAutomata().get(0).getLocalFunctions().get(0);
        assertFalse(inc.hasBody());
        List<Contract> contracts = inc.getContracts();
        assertEquals(2, contracts.size());
        assertEquals(ContractKind.REQUIRES, contracts.get(0).getKind());
        assertEquals("nonNegative", contracts.get(0).getName());
        assertEquals(ContractKind.ENSURES, contracts.get(1).getKind());
        assertNull(contracts.get(1).getName());

        BinaryOpExpression ensures = assertInstanceOf(BinaryOpExpression.class, contracts.get(1).getExpression());
        VariableAccess result = assertInstanceOf(VariableAccess.class, ensures.getLeft());
        assertSame(inc.getResultVariable(), result.getVariable());
        BinaryOpExpression sum = assertInstanceOf(BinaryOpExpression.class, ensures.getRight());
        assertEquals(ArithmeticBinaryOps.ADD, sum.getOp());
        OldValue old = assertInstanceOf(OldValue.class, sum.getLeft());
        assertEquals("count", assertInstanceOf(VariableAccess.class, old.getValue()).getFieldName());
    }

    @Test
    void oldValueOutsidePostConditionIsAnError() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library c;",
                        "types { Int(int32); }",
                        "automaton A : Int { var count: Int; fun f() requires old(count) > 0; }");

        assertEquals(List.of("function A.f: old(count) is only allowed in ensures clauses"), errors(analysis));
    }

    @Test
    void duplicateNamesAreReportedPerOccurrence() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library d;",
                        "types { Int(int32); Int(int64); Int(int8); }",
                        "automaton A : Int { }",
                        "automaton A : Int { }");

        assertEquals(
                List.of("duplicate type 'Int'", "duplicate type 'Int'", "duplicate automaton 'A'"),
                errors(analysis));
    }

    @Test
    void aliasCycleIsReportedForEveryAliasInIt() throws Exception {
        SemanticAnalysis analysis = analyze("library d;", "typealias A1 = B1;", "typealias B1 = A1;");

        assertEquals(
                List.of("typealias A1: type alias cycle: A1 -> B1 -> A1", "typealias B1: type alias cycle: B1 -> A1 -> B1"),
                errors(analysis));
    }

    @Test
    void undeclaredShiftStatesAreReportedPerOccurrence() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library s;",
                        "types { Int(int32); }",
                        "automaton A : Int {",
                        "    initstate s1; state s2;",
                        "    shift (s1, s8, s9) -> s2 (f);",
                        "    fun f();",
                        "}");

        List<String> errors = errors(analysis);
        assertEquals(2, errors.size());
        assertTrue(errors.get(0).endsWith("unresolved state 's8'"), errors.get(0));
        assertTrue(errors.get(1).endsWith("unresolved state 's9'"), errors.get(1));
    }

    @Test
    void shiftGuardSignaturePicksOverload() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library s;",
                        "types { Int(int32); Str(string); }",
                        "automaton A : Int {",
                        "    initstate s1; state s2;",
                        "    shift s1 -> s2 (write(Str));",
                        "    shift s2 -> s1 (write);",
                        "    shift any -> self (write(Int));",
                        "    fun write(x: Int);",
                        "    fun write(x: Str);",
                        "}");

        assertEquals(List.of(), errors(analysis));
        Automaton automaton = analysis.getLibrary().orElseThrow().getAutomata().get(0);
        Function writeInt = automaton.getLocalFunctions().get(0);
        Function writeStr = automaton.getLocalFunctions().get(1);

        assertEquals(List.of(writeStr), automaton.getShifts().get(0).getFunctions());
        assertEquals(List.of(writeInt, writeStr), automaton.getShifts().get(1).getFunctions());
        assertTrue(automaton.getShifts().get(2).getFrom().isAny());
        assertTrue(automaton.getShifts().get(2).getTo().isSelf());
        assertEquals(List.of(writeInt), automaton.getShifts().get(2).getFunctions());
        assertEquals(2, automaton.getStates().size());
    }

    @Test
    void unknownGuardFunctionIsAnError() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library s;",
                        "types { Int(int32); }",
                        "automaton A : Int { initstate s1; shift s1 -> s1 (g(Int)); fun g(); }");

        assertEquals(List.of("automaton A, shift s1 -> s1: unresolved function 'g(Int)'"), errors(analysis));
    }

    @Test
    void unknownTypesHaveNoFallback() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library t;",
                        "types { Int(int32); }",
                        "automaton A : Int { var x: Nope; var p: *Int; }");

        assertEquals(
                List.of(
                        "variable A.x: unresolved type 'Nope'",
                        "variable A.p: semantic type 'Int' cannot take pointer or generic modifiers"),
                errors(analysis));
    }

    @Test
    void unresolvedVariableNamesTheFunction() throws Exception {
        SemanticAnalysis analysis =
                analyze("library t;", "types { Int(int32); }", "automaton A : Int { fun f() { y = 1; } }");

        assertEquals(List.of("function A.f: unresolved variable 'y'"), errors(analysis));
    }

    @Test
    void targetAnnotationRedirectsFunctionTarget() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library t;",
                        "types { Int(int32); }",
                        "automaton A : Int { var n: Int; fun link(@target other: B) { B(other).owner = n; } }",
                        "automaton B (var owner: Int) : Int { }");

        assertEquals(List.of(), errors(analysis));
        Library library = analysis.getLibrary().orElseThrow();
        Automaton a = library.getAutomata().get(0);
        Automaton b = library.getAutomata().get(1);
        Function link = a.getLocalFunctions().get(0);

        assertSame(a, link.getAutomaton());
        assertSame(b, link.getTarget());
        assertSame(b.getType(), link.getArgs().get(0).getType());
        Assignment assignment = assertInstanceOf(Assignment.class, link.getStatements().get(0));
        VariableAccess owner = assertInstanceOf(VariableAccess.class, assignment.getLeft().getChildAccess());
        assertSame(b.findVariable("owner").orElseThrow(), owner.getVariable());
    }

    @Test
    void targetAnnotationMustNameAnAutomaton() throws Exception {
        SemanticAnalysis analysis =
                analyze("library t;", "types { Int(int32); }", "automaton A : Int { fun f(@target x: Int); }");

        assertEquals(List.of("function A.f: @target argument 'x' must name an automaton, not 'Int'"), errors(analysis));
    }

    @Test
    void annotationArgumentsSeeLaterDeclarations() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library t;",
                        "types { Int(int32); }",
                        "automaton A : Int {",
                        "    fun f(@Default(new B(state = s1)) x: Int, @Default(P.x) y: Int): @Limit(P.x) Int;",
                        "}",
                        "automaton B : Int { initstate s1; }",
                        "typealias P = Point;",
                        "type Point { x: Int; }");

        assertEquals(List.of(), errors(analysis));
        Library library = analysis.getLibrary().orElseThrow();
        Function f = library.getAutomata().get(0).getLocalFunctions().get(0);
        Automaton b = library.getAutomata().get(1);

        Annotation first = f.getArgs().get(0).getAnnotation();
        CallAutomatonConstructor call = assertInstanceOf(CallAutomatonConstructor.class, first.getValues().get(0));
        assertSame(b.findState("s1").orElseThrow(), call.getState());
        assertSame(first, call.getParent());

        AccessAlias alias = assertInstanceOf(AccessAlias.class, f.getArgs().get(1).getAnnotation().getValues().get(0));
        assertEquals("Int", alias.getLastChild().getType().getName());
        assertEquals("Limit", f.getTypeAnnotation().getName());
        assertEquals(1, f.getTypeAnnotation().getValues().size());
    }

    @Test
    void unresolvedAnnotationArgumentNamesTheFunction() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library t;",
                        "types { Int(int32); }",
                        "automaton A : Int { fun f(@Default(new B(state = s9)) x: Int); }",
                        "automaton B : Int { initstate s1; }");

        assertEquals(List.of("function A.f: unresolved state 's9' in automaton 'B'"), errors(analysis));
    }

    @Test
    void enumVariantsAndRealTypesResolveAsAccessHeads() throws Exception {
        SemanticAnalysis analysis =
                analyze(
                        "library t;",
                        "types { Int(int32); Str(java.lang.String); }",
                        "enum Color { Red = 0; Green = 1; }",
                        "val FAVOURITE: Color = Color.Green;",
                        "val KIND: Str = java.lang.String;");

        assertEquals(List.of(), errors(analysis));
        Library library = analysis.getLibrary().orElseThrow();

        Variable favourite = library.getGlobalVariables().get("FAVOURITE");
        AccessAlias alias = assertInstanceOf(AccessAlias.class, favourite.getInitValue());
        assertInstanceOf(EnumType.class, alias.getType());
        ChildrenType children = assertInstanceOf(ChildrenType.class, alias.getChildAccess().getType());
        assertSame(((EnumType) alias.getType()).getChildrenType(), children);

        RealTypeAccess kind = assertInstanceOf(RealTypeAccess.class, library.getGlobalVariables().get("KIND").getInitValue());
        assertEquals("java.lang.String", kind.getType().getName());
    }

    @Test
    void parseFailureIsWrappedInLoaderException() {
        LoaderException ex = assertThrows(LoaderException.class, () -> analyze("library t", "types {"));
        assertTrue(ex.getMessage().startsWith("Failed to parse test.lsl: line "), ex.getMessage());
    }

    private static SemanticAnalysis analyze(String... lines) throws LoaderException {
        return new SemanticAnalyzer().analyze("test.lsl", String.join("\n", lines));
    }

    private static List<String> errors(SemanticAnalysis analysis) {
        return analysis.getMessages().stream()
                .filter(message -> message.getLevel() == LoaderMessage.Level.ERROR)
                .map(LoaderMessage::getMessage)
                .collect(Collectors.toList());
    }
}
