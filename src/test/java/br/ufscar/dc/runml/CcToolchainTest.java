package br.ufscar.dc.runml;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Roda o cc de verdade; os testes sao pulados quando nao ha compilador C instalado. */
public class CcToolchainTest {

    private static boolean ccAvailable() {
        try {
            Process p = new ProcessBuilder("cc", "--version")
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
            return p.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String runProgram(Path dir, String source, List<String> args) throws IOException {
        Path ml = dir.resolve("programa.ml");
        Files.writeString(ml, source, StandardCharsets.UTF_8);
        Path out = dir.resolve("saida.txt");
        MlLog log = MlLog.silencioso();
        NativeToolchain cc = new CcToolchain(log, ProcessBuilder.Redirect.to(out.toFile()));
        new MlRunner(dir, cc, log).run(ml, args);
        return Files.readString(out, StandardCharsets.UTF_8);
    }

    @Test
    public void testArithmeticProgram(@TempDir Path dir) throws Exception {
        assumeTrue(ccAvailable());
        assertEquals("17\n", runProgram(dir, "a <- 5\nb <- 3\nc <- a * b + 2\nprint c\n", List.of()));
    }

    @Test
    public void testFunctionProgram(@TempDir Path dir) throws Exception {
        assumeTrue(ccAvailable());
        String source = "function square(x)\n\treturn x * x\n\nn <- 4\nresult <- square(n)\nprint result\n";
        assertEquals("16\n", runProgram(dir, source, List.of()));
    }

    @Test
    public void testRealOutputAndArguments(@TempDir Path dir) throws Exception {
        assumeTrue(ccAvailable());
        assertEquals("3.750000\n", runProgram(dir, "print arg0 / 2\n", List.of("7.5")));
    }

    @Test
    public void testCompileFailure(@TempDir Path dir) throws Exception {
        assumeTrue(ccAvailable());
        Path cFile = dir.resolve("ruim.c");
        Files.writeString(cFile, "int main( {\n", StandardCharsets.UTF_8);
        CcToolchain cc = new CcToolchain(MlLog.silencioso());
        MlException e = assertThrows(MlException.class, () -> cc.compile(cFile, dir.resolve("ruim")));
        assertEquals(MlException.Tipo.FILE, e.getTipo());
        assertEquals("Compilation failed for ruim.c", e.getMessage());
    }
}
