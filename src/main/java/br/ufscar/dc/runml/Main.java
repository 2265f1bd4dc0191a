package br.ufscar.dc.runml;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

public class Main {
    public static void main(String[] args) {
        Opcoes opcoes = Opcoes.parse(args);
        if (opcoes == null) {
            System.err.println(Opcoes.usage());
            System.exit(1);
        }

        PrintWriter pw = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        MlLog log = new MlLog(pw, opcoes.isVerbose());
        log.info("Verbose mode enabled");

        try {
            MlRunner runner = new MlRunner(Paths.get("").toAbsolutePath(), new CcToolchain(log), log);
            runner.run(opcoes.getMlFile(), opcoes.getProgramArgs());
        } catch (MlException e) {
            System.err.println(e.getDiagnostico());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            System.exit(1);
        } finally {
            pw.flush();
        }
    }
}
