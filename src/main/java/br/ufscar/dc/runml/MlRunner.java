package br.ufscar.dc.runml;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Traduz, grava ml_&lt;pid&gt;.c, compila, executa e remove os temporarios,
 * inclusive quando algum passo falha.
 */
public class MlRunner {

    private final Path workDir;
    private final NativeToolchain toolchain;
    private final MlLog log;

    public MlRunner(Path workDir, NativeToolchain toolchain, MlLog log) {
        this.workDir = workDir;
        this.toolchain = toolchain;
        this.log = log;
    }

    public void run(Path mlFile, List<String> programArgs) {
        if (!Files.isReadable(mlFile)) {
            throw MlException.file("Could not open file %s", mlFile);
        }
        log.info("Opened file %s", mlFile);

        String cCode = new MlTradutor(log).translate(mlFile);

        long pid = ProcessHandle.current().pid();
        Path cFile = workDir.resolve("ml_" + pid + ".c");
        Path binary = workDir.resolve("ml_" + pid);
        RuntimeException falha = null;
        try {
            writeCFile(cFile, cCode);
            toolchain.compile(cFile, binary);
            toolchain.execute(binary, programArgs);
        } catch (RuntimeException e) {
            falha = e;
            throw e;
        } finally {
            cleanUp(cFile, binary, falha);
        }
    }

    private void writeCFile(Path cFile, String cCode) {
        try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(cFile, StandardCharsets.UTF_8))) {
            pw.print(cCode);
        } catch (IOException e) {
            throw new MlException(MlException.Tipo.FILE, "Could not create temporary C file.", e);
        }
        log.info("Created temporary C file: %s", cFile.getFileName());
    }

    // Se ja ha um erro em andamento, a falha na remocao fica anexada a ele.
    private void cleanUp(Path cFile, Path binary, RuntimeException falha) {
        log.info("Cleaning up temporary files");
        try {
            Files.deleteIfExists(cFile);
            Files.deleteIfExists(binary);
        } catch (IOException e) {
            MlException erro = new MlException(MlException.Tipo.FILE,
                    "Could not remove temporary files: " + e.getMessage(), e);
            if (falha == null) {
                throw erro;
            }
            log.info("%s", erro.getMessage());
            falha.addSuppressed(erro);
        }
    }
}
