/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.helix;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.helix.compile.Environment;
import net.hydromatic.helix.compile.Environments;
import net.hydromatic.helix.compile.Tracers;
import net.hydromatic.helix.eval.Session;
import net.hydromatic.helix.eval.Setting;
import net.hydromatic.helix.util.Pair;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** Interactive shell for Helix, powered by JLine3. */
public class Shell {
  private final ConfigImpl config;
  private final Terminal terminal;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    try {
      final Shell shell = create(ImmutableList.copyOf(args), System.in,
          System.out);
      shell.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Shell. */
  public static Shell create(List<String> args, InputStream in,
      OutputStream out) throws IOException {
    final Config config = parse(Config.DEFAULT, args);
    return create(config, in, out);
  }

  /** Creates a Shell. */
  public static Shell create(Config config, InputStream in,
      OutputStream out) throws IOException {
    final TerminalBuilder builder = TerminalBuilder.builder();
    builder.streams(in, out);
    final ConfigImpl configImpl = (ConfigImpl) config;
    builder.system(configImpl.system);
    builder.dumb(configImpl.dumb);
    if (configImpl.dumb) {
      builder.type("dumb");
    }
    final Terminal terminal = builder.build();
    return new Shell(config, terminal);
  }

  /** Creates a Shell. */
  public Shell(Config config, Terminal terminal) {
    this.config = (ConfigImpl) config;
    this.terminal = requireNonNull(terminal);
  }

  /** Parses an argument list to an equivalent Config. */
  public static Config parse(Config config, List<String> argList) {
    ConfigImpl c = (ConfigImpl) config;
    final Map<Setting, Object> settingMap = new LinkedHashMap<>(c.settingMap);
    for (String arg : argList) {
      if (arg.equals("--banner=false")) {
        c = c.withBanner(false);
      } else if (arg.equals("--terminal=dumb")) {
        c = c.withDumb(true);
      } else if (arg.equals("--system=false")) {
        c = c.withSystem(false);
      } else if (arg.equals("--echo")) {
        Setting.ECHO.set(settingMap, true);
      } else if (arg.equals("--verify")) {
        Setting.VERIFY_STEPS.set(settingMap, true);
      } else if (arg.equals("--help")) {
        c = c.withHelp(true);
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        Setting.lookup(arg.substring(2, i))
            .setLenient(settingMap, arg.substring(i + 1));
      }
    }
    return c.withSettingMap(settingMap);
  }

  static void usage(Consumer<String> outLines) {
    final String[] usageLines = {
        "Usage: java " + Shell.class.getName() + " [options]",
        "Options:",
        "    --banner=false    Do not print a banner",
        "    --terminal=dumb   Use a dumb terminal",
        "    --stepBudget=N    Maximum reduction steps per statement",
        "    --verify          Re-check the type of the term after each step",
        "    --echo            Print each statement before its result",
        "    --help            Print this help",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  static void help(Consumer<String> outLines) {
    final String[] helpLines = {
        "Enter a statement, terminated by ';'. For example:",
        "    val p = prob_mul(0.5, 0.7);",
        "List of available commands:",
        "    help   Print this help",
        "    quit   Quit shell",
    };
    Arrays.asList(helpLines).forEach(outLines);
  }

  /** Returns whether we can ignore a line. We can ignore a line if it consists
   * only of comments, spaces, and optionally semicolon, and if we are not on a
   * continuation line. */
  private static boolean canIgnoreLine(StringBuilder buf, String line) {
    final String trimmedLine = stripComment(line)
        .replaceAll("\\(\\*.*\\*\\)", "")
        .trim();
    return buf.length() == 0
        && (trimmedLine.isEmpty() || trimmedLine.equals(";"));
  }

  /** Removes from "(*)" to the end of the line, if present. */
  private static String stripComment(String line) {
    return line.replaceAll("\\(\\*\\).*$", "");
  }

  /** Generates a banner to be shown on startup. */
  private String banner() {
    return "helix (java version \"" + System.getProperty("java.version")
        + "\", " + terminal.getName()
        + ", " + terminal.getType() + ")";
  }

  public void run() {
    final Consumer<String> outLines = terminal.writer()::println;
    if (config.help) {
      usage(outLines);
      terminal.writer().flush();
      return;
    }

    final String equalsPrompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold()).append("=")
        .style(AttributedStyle.DEFAULT).append(" ")
        .toAnsi(terminal);
    final String minusPrompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold()).append("-")
        .style(AttributedStyle.DEFAULT).append(" ")
        .toAnsi(terminal);

    if (config.banner) {
      outLines.accept(banner());
    }
    final LineReader lineReader = LineReaderBuilder.builder()
        .appName("helix")
        .terminal(terminal)
        .build();

    final Session session = new Session(new LinkedHashMap<>(config.settingMap));
    final StringBuilder buf = new StringBuilder();
    Environment env = Environments.base();
    for (;;) {
      final Pair<LineType, String> line =
          read(lineReader, buf, minusPrompt, equalsPrompt);
      switch (line.left) {
      case EOF:
      case QUIT:
        terminal.writer().flush();
        return;

      case INTERRUPT:
        buf.setLength(0);
        continue;

      case IGNORE:
        continue;

      case HELP:
        help(outLines);
        continue;

      default:
        buf.append(line.right);
        if (!line.right.trim().endsWith(";")) {
          buf.append("\n");
          continue;
        }
        final String code = buf.toString();
        buf.setLength(0);
        if (Setting.ECHO.booleanValue(session.map)) {
          outLines.accept(code);
        }
        env = command(session, env, code, outLines);
        terminal.writer().flush();
      }
    }
  }

  /** Checks and runs one or more statements, and returns the environment
   * that subsequent statements will see. */
  static Environment command(Session session, Environment env, String code,
      Consumer<String> outLines) {
    final Helix.Checked checked =
        Helix.typecheck(code, "stdIn", env, Tracers.empty());
    if (!checked.isValid()) {
      checked.errorLines().forEach(outLines);
      return env;
    }
    final Helix.Result result =
        Helix.run(checked.program(), session, Tracers.empty());
    result.lines.forEach(outLines);
    if (result.error != null) {
      final StringBuilder b = new StringBuilder();
      session.handle(result.error, b);
      outLines.accept(b.toString());
    }
    return result.env;
  }

  private Pair<LineType, String> read(LineReader lineReader,
      StringBuilder buf, String minusPrompt, String equalsPrompt) {
    final String line;
    try {
      line = lineReader.readLine(buf.length() == 0 ? minusPrompt
          : equalsPrompt);
    } catch (UserInterruptException e) {
      return Pair.of(LineType.INTERRUPT, "");
    } catch (EndOfFileException e) {
      return Pair.of(LineType.EOF, "");
    }
    if (canIgnoreLine(buf, line)) {
      return Pair.of(LineType.IGNORE, line);
    }
    final String trimmed = line.trim();
    if (buf.length() == 0) {
      if (trimmed.equals("quit")) {
        return Pair.of(LineType.QUIT, line);
      }
      if (trimmed.equals("help")) {
        return Pair.of(LineType.HELP, line);
      }
    }
    return Pair.of(LineType.REGULAR, stripComment(line));
  }

  /** Type of line read from the terminal. */
  enum LineType {
    QUIT,
    EOF,
    INTERRUPT,
    IGNORE,
    HELP,
    REGULAR
  }

  /** Shell configuration. */
  public interface Config {
    Config DEFAULT =
        new ConfigImpl(true, false, true, false, ImmutableMap.of());

    Config withBanner(boolean banner);
    Config withDumb(boolean dumb);
    Config withSystem(boolean system);
    Config withHelp(boolean help);
    Config withSettingMap(Map<Setting, Object> settingMap);
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    private final boolean banner;
    private final boolean dumb;
    private final boolean system;
    private final boolean help;
    private final ImmutableMap<Setting, Object> settingMap;

    private ConfigImpl(boolean banner, boolean dumb, boolean system,
        boolean help, ImmutableMap<Setting, Object> settingMap) {
      this.banner = banner;
      this.dumb = dumb;
      this.system = system;
      this.help = help;
      this.settingMap = requireNonNull(settingMap, "settingMap");
    }

    @Override public ConfigImpl withBanner(boolean banner) {
      if (this.banner == banner) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, help, settingMap);
    }

    @Override public ConfigImpl withDumb(boolean dumb) {
      if (this.dumb == dumb) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, help, settingMap);
    }

    @Override public ConfigImpl withSystem(boolean system) {
      if (this.system == system) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, help, settingMap);
    }

    @Override public ConfigImpl withHelp(boolean help) {
      if (this.help == help) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, help, settingMap);
    }

    @Override public ConfigImpl withSettingMap(
        Map<Setting, Object> settingMap) {
      if (this.settingMap.equals(settingMap)) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, help,
          ImmutableMap.copyOf(settingMap));
    }
  }
}

// End Shell.java
