package br.ufscar.dc.runml;

import java.nio.file.Path;
import java.util.List;

/** Compilador C externo e execucao do binario gerado. Falhas viram MlException do tipo FILE. */
public interface NativeToolchain {

    void compile(Path cFile, Path binary);

    void execute(Path binary, List<String> args);
}
