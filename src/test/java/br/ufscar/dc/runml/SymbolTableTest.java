package br.ufscar.dc.runml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import br.ufscar.dc.runml.SymbolTable.FunctionEntry;
import br.ufscar.dc.runml.SymbolTable.MlType;

public class SymbolTableTest {

    @Test
    public void testLocalShadowsGlobal() {
        SymbolTable table = new SymbolTable();
        table.addGlobal("x", MlType.INTEGER);
        table.openScope();
        assertEquals(MlType.INTEGER, table.getVariableType("x"));
        table.addLocal("x", MlType.REAL);
        assertEquals(MlType.REAL, table.getVariableType("x"));
        table.closeScope();
        assertEquals(MlType.INTEGER, table.getVariableType("x"));
        assertNull(table.getVariableType("y"));
    }

    @Test
    public void testGlobalsKeepRegistrationOrderAndFirstType() {
        SymbolTable table = new SymbolTable();
        table.addGlobal("b", MlType.INTEGER);
        table.addGlobal("a", MlType.REAL);
        table.addGlobal("b", MlType.REAL);
        assertEquals(List.of("b", "a"), table.getGlobalNames());
        assertEquals(MlType.INTEGER, table.getGlobalType("b"));
    }

    @Test
    public void testGlobalCapacity() {
        SymbolTable table = new SymbolTable();
        for (int i = 0; i < SymbolTable.MAX_GLOBAL_VARS; i++) {
            table.addGlobal("v" + i, MlType.INTEGER);
        }
        MlException e = assertThrows(MlException.class, () -> table.addGlobal("extra", MlType.INTEGER));
        assertEquals(MlException.Tipo.SYNTAX, e.getTipo());
        assertEquals("Too many variables defined.", e.getMessage());
    }

    @Test
    public void testLocalCapacity() {
        SymbolTable table = new SymbolTable();
        table.openScope();
        for (int i = 0; i < SymbolTable.MAX_LOCAL_VARS; i++) {
            table.addLocal("v" + i, MlType.INTEGER);
        }
        assertThrows(MlException.class, () -> table.addLocal("extra", MlType.INTEGER));
    }

    @Test
    public void testFunctionCapacityAndDuplicates() {
        SymbolTable table = new SymbolTable();
        table.addFunction("f", List.of());
        MlException dup = assertThrows(MlException.class, () -> table.addFunction("f", List.of()));
        assertEquals("Function already defined: f", dup.getMessage());
        for (int i = 1; i < SymbolTable.MAX_FUNCTIONS; i++) {
            table.addFunction("g" + i, List.of());
        }
        MlException e = assertThrows(MlException.class, () -> table.addFunction("h", List.of()));
        assertEquals("Too many functions defined.", e.getMessage());
    }

    @Test
    public void testCallSiteInference() {
        SymbolTable table = new SymbolTable();
        FunctionEntry f = table.addFunction("f", List.of("a", "b"));
        assertEquals(List.of(MlType.UNKNOWN, MlType.UNKNOWN), f.getParameterTypes());
        assertEquals(MlType.UNKNOWN, f.getReturnType());

        f.inferFromCall(List.of(MlType.REAL, MlType.INTEGER, MlType.REAL));
        assertEquals(List.of(MlType.REAL, MlType.INTEGER), f.getParameterTypes());
        assertEquals(MlType.REAL, f.getReturnType());

        f.resolveSignature();
        assertEquals(List.of(MlType.REAL, MlType.INTEGER), f.getParameterTypes());
    }

    @Test
    public void testUnresolvedSignatureDefaultsToReal() {
        SymbolTable table = new SymbolTable();
        FunctionEntry f = table.addFunction("f", List.of("a", "b"));
        f.resolveSignature();
        assertEquals(List.of(MlType.REAL, MlType.REAL), f.getParameterTypes());
        assertEquals(MlType.REAL, f.getReturnType());

        FunctionEntry g = table.addFunction("g", List.of());
        g.resolveSignature();
        assertEquals(MlType.REAL, g.getReturnType());

        FunctionEntry h = table.addFunction("h", List.of("a", "b"));
        h.inferFromCall(List.of(MlType.INTEGER));
        h.resolveSignature();
        assertEquals(List.of(MlType.INTEGER, MlType.REAL), h.getParameterTypes());
        assertEquals(MlType.INTEGER, h.getReturnType());
    }

    @Test
    public void testProgramArgumentsAreRealGlobals() {
        SymbolTable table = new SymbolTable();
        table.addProgramArgument(1, "arg1");
        table.addProgramArgument(0, "arg0");
        table.addProgramArgument(1, "arg1");
        assertEquals(List.of(0, 1), List.copyOf(table.getProgramArguments().keySet()));
        assertEquals(MlType.REAL, table.getGlobalType("arg0"));
        assertEquals(List.of("arg1", "arg0"), table.getGlobalNames());
    }
}
