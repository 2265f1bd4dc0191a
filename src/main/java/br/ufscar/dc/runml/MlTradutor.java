package br.ufscar.dc.runml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Traduz um programa ml completo para C: primeira passada sobre um cursor,
 * segunda passada sobre um cursor novo da mesma fonte.
 */
public class MlTradutor {

    /** Abre a fonte do zero; chamada uma vez por passada. */
    @FunctionalInterface
    public interface Fonte {
        LineCursor open() throws IOException;
    }

    private final MlLog log;

    public MlTradutor(MlLog log) {
        this.log = log;
    }

    public String translate(Path mlFile) {
        return translate(() -> LineCursor.open(mlFile));
    }

    public String translateSource(String source) {
        return translate(() -> LineCursor.of(source));
    }

    public String translate(Fonte fonte) {
        SymbolTable symbolTable = new SymbolTable();
        MlSemantico semantico = new MlSemantico(symbolTable, log);
        try (LineCursor cursor = fonte.open()) {
            semantico.collect(cursor);
        } catch (IOException | UncheckedIOException e) {
            throw new MlException(MlException.Tipo.FILE, "Could not read ml source: " + e.getMessage(), e);
        }

        MlGeradorC gerador = new MlGeradorC(semantico, log);
        try (LineCursor cursor = fonte.open()) {
            gerador.generate(cursor);
        } catch (IOException | UncheckedIOException e) {
            throw new MlException(MlException.Tipo.FILE, "Could not read ml source: " + e.getMessage(), e);
        }
        return gerador.getOutput();
    }
}
