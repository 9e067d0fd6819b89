package com.libsl.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.libsl.asg.Action;
import com.libsl.asg.Automaton;
import com.libsl.asg.Function;
import com.libsl.asg.Library;
import com.libsl.asg.MetaNode;
import com.libsl.asg.Shift;
import com.libsl.asg.TargetAnnotation;
import com.libsl.asg.type.EnumLikeSemanticType;
import com.libsl.asg.type.RealType;
import com.libsl.asg.type.SimpleType;
import com.libsl.asg.type.Type;
import com.libsl.asg.type.TypeAlias;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LibslLoaderTest {

    @Test
    void loadsSpecificationFile() throws Exception {
        LoaderResult result = new LibslLoader().load(resource("specs/files.lsl"));
        Library library = result.getLibrary();

        assertEquals(List.of(), result.getMessages());
        MetaNode metadata = library.getMetadata();
        assertEquals("files", metadata.getName());
        assertEquals("1.0", metadata.getLibraryVersion());
        assertEquals("java", metadata.getLanguage());
        assertEquals("https://example.org/files", metadata.getUrl());
        assertEquals("1.0.0", metadata.getStringVersion());
        assertEquals(List.of("java.io"), library.getImports());
        assertEquals(List.of("common.lsl"), library.getIncludes());

        assertEquals(
                List.of("Int", "Str", "Ptr", "Bytes", "Mode", "Size", "Length", "Buffer", "Color"),
                library.getSemanticTypes().stream().map(Type::getName).collect(Collectors.toList()));
        Type ptr = library.getContext().resolveType("Ptr").orElseThrow();
        assertEquals("*Ptr", ptr.getFullName());
        SimpleType bytes = assertInstanceOf(SimpleType.class, library.getContext().resolveType("Bytes").orElseThrow());
        RealType list = assertInstanceOf(RealType.class, bytes.getRealType());
        assertEquals("java.util.List<Int>", list.toString());
        EnumLikeSemanticType mode =
                assertInstanceOf(EnumLikeSemanticType.class, library.getContext().resolveType("Mode").orElseThrow());
        assertEquals(-1, mode.getEntries().get(2).getValue().getValue());
        TypeAlias length = assertInstanceOf(TypeAlias.class, library.getContext().resolveType("Length").orElseThrow());
        assertSame(library.getContext().resolveType("Int").orElseThrow(), length.resolveOriginal());
    }

    @Test
    void buildsAutomataWithShiftsAndExtensionFunctions() throws Exception {
        Library library = new LibslLoader().load(resource("specs/files.lsl")).getLibrary();
        Automaton file = library.getAutomata().get(0);
        Automaton reader = library.getAutomata().get(1);

        assertEquals("File", file.getName());
        assertEquals(
                List.of("Created", "Opened", "Closed"),
                file.getStates().stream().map(state -> state.getName()).collect(Collectors.toList()));
        assertEquals(
                List.of("count", "buffer", "reader", "path", "mode"),
                file.getVariables().stream().map(variable -> variable.getName()).collect(Collectors.toList()));
        assertNotNull(file.findVariable("mode").orElseThrow().getInitValue());

        assertEquals(
                List.of("open", "write", "write", "close", "first", "link", "dispose"),
                file.getFunctions().stream().map(Function::getName).collect(Collectors.toList()));

        List<Shift> shifts = file.getShifts();
        assertEquals(5, shifts.size());
        assertEquals("Created -> Closed (close)", shifts.get(1).toString());
        assertEquals("Opened -> Closed (close)", shifts.get(2).toString());
        assertTrue(shifts.get(3).getTo().isSelf());
        assertEquals(2, shifts.get(3).getFunctions().size());
        assertTrue(shifts.get(4).getFrom().isAny());
        assertSame(file, shifts.get(4).getFrom().getAutomaton());
        assertEquals("dispose", shifts.get(4).getFunctions().get(0).getName());

        Function open = file.getLocalFunctions().get(0);
        assertSame(file, open.getTarget());
        assertEquals(2, open.getContracts().size());
        assertEquals(4, open.getStatements().size());
        Action log = assertInstanceOf(Action.class, open.getStatements().get(3));
        assertEquals("LOG", log.getName());
        assertEquals("Name", open.getArgs().get(0).getAnnotation().getName());

        Function first = file.getLocalFunctions().get(4);
        assertEquals("Nullable", first.getTypeAnnotation().getName());

        Function link = file.getLocalFunctions().get(5);
        assertSame(reader, link.getTarget());
        TargetAnnotation target = assertInstanceOf(TargetAnnotation.class, link.getArgs().get(0).getAnnotation());
        assertSame(reader, target.getTargetAutomaton());

        Function close = file.getLocalFunctions().get(3);
        assertFalse(close.hasBody());
    }

    @Test
    void loadsFromTextAndKeepsWarnings() throws Exception {
        LoaderResult result =
                new LibslLoader().load("inline.lsl", "library w;\ntypes { Int(int32); }\nautomaton A : Int { state s; }");

        assertEquals(1, result.getMessages().size());
        LoaderMessage warning = result.getMessages().get(0);
        assertEquals(LoaderMessage.Level.WARNING, warning.getLevel());
        assertEquals("automaton A declares no initial state", warning.getMessage());
    }

    @Test
    void firstErrorFailsTheLoad() {
        LoaderException ex =
                assertThrows(
                        LoaderException.class,
                        () -> new LibslLoader().load("test.lsl", "library t;\nfun Missing.f();\nfun Other.g();"));
        assertEquals(
                "Validation failed: function Missing.f: unresolved automaton 'Missing' (test.lsl:2:1)",
                ex.getMessage());
    }

    @Test
    void missingFileIsReported(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("missing.lsl");
        LoaderException ex = assertThrows(LoaderException.class, () -> new LibslLoader().load(missing));
        assertTrue(ex.getMessage().startsWith("Failed to read specification: "), ex.getMessage());
    }

    @Test
    void loadsFromTemporaryFile(@TempDir Path tempDir) throws Exception {
        Path spec = tempDir.resolve("tmp.lsl");
        Files.writeString(spec, "library tmp;\ntypes { Int(int32); }\nval X: Int = 1;\n");

        Library library = new LibslLoader().load(spec).getLibrary();
        assertEquals("tmp", library.getMetadata().getName());
        assertTrue(library.getGlobalVariables().containsKey("X"));
    }

    private static Path resource(String name) throws Exception {
        return Path.of(LibslLoaderTest.class.getClassLoader().getResource(name).toURI());
    }
}
