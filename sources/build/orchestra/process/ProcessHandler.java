package build.orchestra.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.stream.Stream;

public interface ProcessHandler {

    List<String> commands();

    int execute(Path directory, Path output, Path error) throws IOException;

    final class OfProcess implements ProcessHandler {

        private static final boolean WINDOWS = System.getProperty("os.name", "").toLowerCase().contains("win");

        private final List<String> commands;

        private OfProcess(List<String> commands) {
            this.commands = commands;
        }

        public static Function<List<String>, ProcessHandler> of(List<String> program) {
            return arguments -> new OfProcess(Stream.concat(program.stream(), arguments.stream()).toList());
        }

        public static Function<List<String>, ProcessHandler> ofCommand(String command) {
            return of(List.of(WINDOWS ? command + ".bat" : command));
        }

        @Override
        public List<String> commands() {
            return commands;
        }

        @Override
        public int execute(Path directory, Path output, Path error) throws IOException {
            Process process = new ProcessBuilder(commands)
                    .directory(directory.toFile())
                    .redirectOutput(output.toFile())
                    .redirectError(error.toFile())
                    .start();
            try {
                return process.waitFor();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                CancellationException exception = new CancellationException("Canceled " + String.join(" ", commands));
                exception.initCause(e);
                throw exception;
            }
        }
    }
}
