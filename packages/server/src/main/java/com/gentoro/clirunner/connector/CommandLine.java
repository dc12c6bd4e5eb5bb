package com.gentoro.clirunner.connector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Executable plus its arguments, ready to hand to a {@link ProcessBuilder}. */
public record CommandLine(String executable, List<String> arguments) {

  public CommandLine {
    Objects.requireNonNull(executable, "executable");
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
  }

  public List<String> toList() {
    List<String> command = new ArrayList<>(arguments.size() + 1);
    command.add(executable);
    command.addAll(arguments);
    return command;
  }
}
