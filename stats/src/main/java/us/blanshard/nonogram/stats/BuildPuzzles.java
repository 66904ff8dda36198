/*
Copyright 2026 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.nonogram.stats;

import static java.nio.charset.StandardCharsets.UTF_8;

import us.blanshard.nonogram.core.Config;
import us.blanshard.nonogram.gen.Outcome;
import us.blanshard.nonogram.gen.PuzzleBuilder;
import us.blanshard.nonogram.gen.PuzzleJson;

import com.google.common.io.Files;
import com.google.gson.JsonParseException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.List;
import java.util.Properties;
import java.util.logging.LogManager;

/**
 * Reads a json file of candidates, turns the good ones into puzzles, writes
 * the puzzles as json, and prints a report on the batch.
 *
 * @author Luke Blanshard
 */
public class BuildPuzzles {
  public static void main(String[] args) throws IOException, InterruptedException {
    if (args.length < 2 || args.length > 4) exitWithUsage();
    File input = new File(args[0]);
    File output = new File(args[1]);
    Config config = Config.DEFAULT;
    int threads = Runtime.getRuntime().availableProcessors();
    try {
      if (args.length > 2) config = loadConfig(new File(args[2]));
      if (args.length > 3) threads = Integer.decode(args[3]);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      exitWithUsage();
      return;  // Convince the compiler.
    }

    configureLogging();

    List<PuzzleJson.Entry> entries;
    try (Reader reader = Files.newReader(input, UTF_8)) {
      entries = PuzzleJson.readEntries(reader);
    } catch (JsonParseException e) {
      System.err.println("Can't read " + input + ": " + e.getMessage());
      System.exit(1);
      return;
    }

    System.out.printf("Building puzzles from %d candidates with %s%n", entries.size(), config);
    List<Outcome> outcomes =
        new BatchRunner(new PuzzleBuilder(config), threads).runEntries(entries);
    BatchReport report = new BatchReport(outcomes);
    Files.asCharSink(output, UTF_8).write(PuzzleJson.toJson(report.accepted()));
    System.out.print(report.format());
    System.out.printf("Wrote %d puzzles to %s%n", report.accepted().size(), output);
  }

  private static void exitWithUsage() {
    System.err.println(
        "Usage: BuildPuzzles <candidates.json> <puzzles.json> [<config.properties>] [<threads>]");
    System.exit(1);
  }

  static Config loadConfig(File file) throws IOException {
    Properties props = new Properties();
    try (Reader reader = Files.newReader(file, UTF_8)) {
      props.load(reader);
    }
    return Config.fromProperties(props);
  }

  private static void configureLogging() throws IOException {
    InputStream in = BuildPuzzles.class.getResourceAsStream("/logging.properties");
    if (in == null) return;
    try {
      LogManager.getLogManager().readConfiguration(in);
    } finally {
      in.close();
    }
  }
}
