package com.libsl.asg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.libsl.asg.type.RealType;
import com.libsl.asg.type.Type;
import java.util.List;
import org.junit.jupiter.api.Test;

class FunctionTest {

    private final LslContext context = new LslContext();
    private final Type intType = new RealType(List.of("int32"), false, null, context);

    @Test
    void automatonDeclaredAfterFunctionStillResolves() {
        Function function = new Function("open", "A", intType, true, context);
        assertFalse(function.isAutomatonResolved());
        assertThrows(IllegalStateException.class, function::getAutomaton);

        Automaton automaton = new Automaton("A", intType);
        context.registerAutomaton(automaton);

        assertSame(automaton, function.resolveAutomaton());
        assertSame(automaton, function.getAutomaton());
        assertEquals("A.open", function.getQualifiedName());
    }

    @Test
    void missingAutomatonIsUnresolved() {
        Function function = new Function("open", "Missing", null, false, context);
        UnresolvedReferenceException ex =
                assertThrows(UnresolvedReferenceException.class, function::resolveAutomaton);
        assertEquals("automaton", ex.getKind());
        assertEquals("Missing", ex.getName());
        assertEquals("unresolved automaton 'Missing'", ex.getMessage());
    }

    @Test
    void argumentsAndResultVariableCarryScopedNames() {
        Function function = new Function("write", "A", intType, true, context);
        FunctionArgument data = new FunctionArgument("data", intType, 0, null);
        function.addArgument(data);
        ResultVariable result = new ResultVariable(intType);
        function.setResultVariable(result);

        assertEquals("write.data", data.getFullName());
        assertEquals("result", result.getFullName());
        assertSame(function, data.getFunction());
        assertSame(function, result.getParent());
    }

    @Test
    void targetIsBoundOnce() {
        Function function = new Function("open", "A", null, true, context);
        Automaton a = new Automaton("A", intType);
        Automaton b = new Automaton("B", intType);

        assertFalse(function.hasTarget());
        function.bindTarget(b);
        function.bindTarget(b);
        assertSame(b, function.getTarget());
        assertThrows(IllegalStateException.class, () -> function.bindTarget(a));
    }

    @Test
    void contractsKeepDeclarationOrder() {
        Function function = new Function("open", "A", null, true, context);
        Contract requires = new Contract("positive", new BoolLiteral(true), ContractKind.REQUIRES);
        Contract ensures = new Contract(null, new BoolLiteral(false), ContractKind.ENSURES);
        function.addContract(requires);
        function.addContract(ensures);

        assertEquals(List.of(requires, ensures), function.getContracts());
        assertEquals("requires positive: true", requires.toString());
        assertEquals("ensures false", ensures.toString());
        assertTrue(function.hasBody());
    }
}
