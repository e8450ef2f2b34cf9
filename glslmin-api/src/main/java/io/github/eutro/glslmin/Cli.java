package io.github.eutro.glslmin;

import io.github.eutro.glslmin.api.CompilerOptions;
import io.github.eutro.glslmin.api.GlslCompiler;
import io.github.eutro.glslmin.api.PreprocessorException;
import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import io.github.eutro.glslmin.core.parse.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public class Cli {
    private static final Logger LOGGER = LoggerFactory.getLogger(Cli.class);

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    /**
     * Run the command line interface.
     *
     * @param args The arguments.
     * @param out  Where to write the compiled program, unless an output file is given, and the help.
     * @param err  Where to write errors.
     * @return The exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> paths = new ArrayList<>();
        List<Path> includeDirs = new ArrayList<>();
        CompilerOptions options = new CompilerOptions();
        Path output = null;
        Path vertexFile = null;
        Path fragmentFile = null;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            err.printf("%s: expected file%n", arg);
                            return 1;
                        }
                        if (output != null) {
                            err.printf("%s: output already specified%n", arg);
                            return 1;
                        }
                        output = Paths.get(args[i++]);
                        break;
                    case "-I":
                    case "--include":
                        if (i == args.length) {
                            err.printf("%s: expected directory%n", arg);
                            return 1;
                        }
                        includeDirs.add(Paths.get(args[i++]));
                        break;
                    case "--vertex":
                    case "--fragment":
                        if (i == args.length) {
                            err.printf("%s: expected file%n", arg);
                            return 1;
                        }
                        if ("--vertex".equals(arg)) {
                            vertexFile = Paths.get(args[i++]);
                        } else {
                            fragmentFile = Paths.get(args[i++]);
                        }
                        break;
                    case "--variable-renaming":
                    case "--consolidate-declarations":
                        if (i == args.length) {
                            err.printf("%s: expected one of all, internal, off%n", arg);
                            return 1;
                        }
                        try {
                            CompilerOptions.Level level = CompilerOptions.Level.parse(args[i++]);
                            if ("--variable-renaming".equals(arg)) {
                                options.variableRenaming = level;
                            } else {
                                options.declarationConsolidation = level;
                            }
                        } catch (IllegalArgumentException e) {
                            err.printf("%s: %s%n", arg, e.getMessage());
                            return 1;
                        }
                        break;
                    case "--no-dead-function-removal":
                        options.deadFunctionRemoval = false;
                        break;
                    case "--no-brace-removal":
                        options.braceRemoval = false;
                        break;
                    case "--no-function-renaming":
                        options.functionRenaming = false;
                        break;
                    case "--no-constructor-minification":
                        options.constructorMinification = false;
                        break;
                    case "--pretty-print":
                        options.prettyPrint = true;
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }

        boolean separateShaders = vertexFile != null || fragmentFile != null;
        if (separateShaders && (vertexFile == null || fragmentFile == null)) {
            err.println("--vertex and --fragment must be given together");
            return 1;
        }
        if (separateShaders ? !paths.isEmpty() : paths.size() != 1) {
            printHelp(err);
            return 1;
        }

        GlslCompiler compiler = new GlslCompiler(options);
        long start = System.nanoTime();
        ShaderProgram program;
        try {
            if (separateShaders) {
                program = compiler.compile(compiler.loadShaders(readFile(vertexFile), readFile(fragmentFile)));
            } else {
                Path input = Paths.get(paths.get(0));
                Map<String, String> libraryFiles = new LinkedHashMap<>();
                for (Path dir : includeDirs) {
                    loadLibraryFiles(dir, libraryFiles);
                }
                Path inputDir = input.toAbsolutePath().getParent();
                if (inputDir != null) loadLibraryFiles(inputDir, libraryFiles);
                String fileName = input.getFileName().toString();
                libraryFiles.put(fileName, readFile(input));
                program = compiler.compileFile(fileName, libraryFiles);
            }
        } catch (IOException e) {
            err.printf("could not read file: %s%n", e);
            return 1;
        } catch (PreprocessorException | ParseException e) {
            err.println(e.getMessage());
            return 1;
        }
        LOGGER.info("Compiled program in {} ms", (System.nanoTime() - start) / 1_000_000);

        String result = GlslCompiler.formatOutput(program);
        if (output == null) {
            out.print(result);
        } else {
            try {
                Files.write(output, result.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                err.printf("could not write file %s: %s%n", output, e);
                return 1;
            }
        }
        return 0;
    }

    private static String readFile(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private static void loadLibraryFiles(Path dir, Map<String, String> libraryFiles) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("not a directory: " + dir);
        }
        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".glsl") || name.endsWith(".glsllib");
                    })
                    .forEach(files::add);
        }
        for (Path file : files) {
            String name = dir.relativize(file).toString().replace('\\', '/');
            libraryFiles.putIfAbsent(name, readFile(file));
            LOGGER.debug("Found library file {}", name);
        }
    }

    private static void printHelp(PrintStream out) {
        out.println(
                "usage: glslmin [-h|--help] [-o|--output <file>] [-I|--include <dir>]... [options] <file>\n" +
                        "       glslmin [options] --vertex <file> --fragment <file>\n" +
                        "\n" +
                        "  <file> : the program file, whose directory is searched for .glsl and .glsllib includes\n" +
                        "  -o|--output <file> : write the compiled program to <file> instead of standard output\n" +
                        "  -I|--include <dir> : also search <dir> for includes\n" +
                        "  --vertex <file> --fragment <file> : compile two plain shaders instead of a program file\n" +
                        "  --variable-renaming all|internal|off : which variables to rename (default all)\n" +
                        "  --consolidate-declarations all|internal|off : which declarations to merge (default all)\n" +
                        "  --no-dead-function-removal : keep unused functions\n" +
                        "  --no-brace-removal : keep braces around single statements\n" +
                        "  --no-function-renaming : keep function names\n" +
                        "  --no-constructor-minification : keep constructor arguments as written\n" +
                        "  --pretty-print : indent the output\n" +
                        "  -h|--help : show this help"
        );
    }
}
