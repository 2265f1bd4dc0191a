package br.ufscar.dc.runml;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Usa o "cc" do sistema com -std=c11 -Wall -Werror. */
public class CcToolchain implements NativeToolchain {

    private final MlLog log;
    private final ProcessBuilder.Redirect programOutput;

    public CcToolchain(MlLog log) {
        this(log, ProcessBuilder.Redirect.INHERIT);
    }

    public CcToolchain(MlLog log, ProcessBuilder.Redirect programOutput) {
        this.log = log;
        this.programOutput = programOutput;
    }

    @Override
    public void compile(Path cFile, Path binary) {
        List<String> command = List.of("cc", "-std=c11", "-Wall", "-Werror", "-o", binary.toString(), cFile.toString());
        log.info("Compiling the C file with command: %s", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command).inheritIO();
        if (run(pb) != 0) {
            throw MlException.file("Compilation failed for %s", cFile.getFileName());
        }
    }

    @Override
    public void execute(Path binary, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(binary.toAbsolutePath().toString());
        command.addAll(args);
        log.info("Executing the compiled program with command: %s", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command).inheritIO().redirectOutput(programOutput);
        if (run(pb) != 0) {
            throw MlException.file("Execution failed for %s", binary.getFileName());
        }
    }

    private int run(ProcessBuilder pb) {
        try {
            return pb.start().waitFor();
        } catch (IOException e) {
            throw new MlException(MlException.Tipo.FILE, "Could not start " + pb.command().get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MlException(MlException.Tipo.FILE, "Interrupted while running " + pb.command().get(0), e);
        }
    }
}
