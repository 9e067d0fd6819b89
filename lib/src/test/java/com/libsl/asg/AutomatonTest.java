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

class AutomatonTest {

    private final LslContext context = new LslContext();
    private final Type intType = new RealType(List.of("int32"), false, null, context);

    private Library newLibrary() {
        return new Library(new MetaNode("Simple", null, null, null, null), List.of(), List.of(), context);
    }

    @Test
    void functionsAreLocalThenExtensionsIncludingDuplicates() {
        Library library = newLibrary();
        Automaton automaton = new Automaton("A", intType);
        assertTrue(library.addAutomaton(automaton));

        Function open = new Function("open", "A", null, true, context);
        Function close = new Function("close", "A", null, false, context);
        automaton.addLocalFunction(open);
        automaton.addLocalFunction(close);
        assertEquals(List.of(open, close), automaton.getFunctions());

        Function extension = new Function("touch", "A", null, true, context);
        Function duplicate = new Function("open", "A", null, true, context);
        library.addExtensionFunction(extension);
        library.addExtensionFunction(duplicate);
        library.addExtensionFunction(new Function("other", "B", null, true, context));

        assertEquals(List.of(open, close, extension, duplicate), automaton.getFunctions());
        assertEquals(List.of(open, close), automaton.getLocalFunctions());
    }

    @Test
    void functionsOfDetachedAutomatonAreLocalOnly() {
        Automaton automaton = new Automaton("A", intType);
        Function open = new Function("open", "A", null, true, context);
        automaton.addLocalFunction(open);
        assertEquals(List.of(open), automaton.getFunctions());
    }

    @Test
    void variablesAreInternalThenConstructorVariables() {
        Automaton automaton = new Automaton("A", intType);
        ConstructorArgument v = new ConstructorArgument("v", intType);
        AutomatonVariableDeclaration count = new AutomatonVariableDeclaration("count", intType);
        automaton.addConstructorVariable(v);
        automaton.addInternalVariable(count);

        assertEquals(List.<Variable>of(count, v), automaton.getVariables());
        assertEquals("A.v", v.getFullName());
        assertEquals("A.count", count.getFullName());
        assertSame(automaton, v.getAutomaton());
        assertSame(count, automaton.findVariable("count").orElseThrow());
    }

    @Test
    void statesBelongToTheirAutomaton() {
        Automaton automaton = new Automaton("A", intType);
        State created = new State("Created", StateKind.INIT);
        automaton.addState(created);

        assertSame(automaton, created.getAutomaton());
        assertSame(created, automaton.findState("Created").orElseThrow());
        assertTrue(automaton.findState("Closed").isEmpty());

        Automaton other = new Automaton("B", intType);
        assertThrows(IllegalStateException.class, () -> other.addState(created));
        assertThrows(IllegalStateException.class, () -> new State("Loose", StateKind.SIMPLE).getAutomaton());
    }

    @Test
    void pseudoStatesAreSharedAndNotListed() {
        Automaton automaton = new Automaton("A", intType);
        State any = automaton.getAnyState();
        State self = automaton.getSelfState();

        assertTrue(any.isAny());
        assertFalse(any.isSelf());
        assertTrue(self.isSelf());
        assertSame(any, automaton.getAnyState());
        assertSame(self, automaton.getSelfState());
        assertTrue(automaton.getStates().isEmpty());
        assertSame(automaton, self.getAutomaton());
    }

    @Test
    void duplicateAutomatonNamesAreRejected() {
        Library library = newLibrary();
        Automaton first = new Automaton("A", intType);
        Automaton second = new Automaton("A", intType);

        assertTrue(library.addAutomaton(first));
        assertFalse(library.addAutomaton(second));
        assertEquals(List.of(first), library.getAutomata());
        assertSame(first, context.resolveAutomaton("A").orElseThrow());
    }

    @Test
    void stateKindKeywordsMapExactly() {
        assertEquals(StateKind.INIT, StateKind.fromString("initstate"));
        assertEquals(StateKind.SIMPLE, StateKind.fromString("state"));
        assertEquals(StateKind.FINISH, StateKind.fromString("finishstate"));
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> StateKind.fromString("endstate"));
        assertTrue(ex.getMessage().contains("endstate"));
        assertThrows(IllegalArgumentException.class, () -> StateKind.fromString("InitState"));
    }
}
