package com.kinetic.modeller.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.kinetic.modeller.codegen.util.FileWriteUtil;
import com.kinetic.modeller.solver.SolverMethod;

import lombok.Value;

/**
 * Source of a generated single-file integration program.
 */
@Value
public class GeneratedProgram {
    String className;
    SolverMethod solver;
    String source;

    public String fileName() {
        return className + ".java";
    }

    /**
     * Writes the program to {@code target}, or to {@code <className>.java} inside it when it is a directory.
     */
    public Path writeTo(Path target) throws IOException {
        Path file = Files.isDirectory(target) ? target.resolve(fileName()) : target;
        FileWriteUtil.safeWriteString(file, source);
        return file;
    }
}
