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
package us.blanshard.nonogram.gen;

import us.blanshard.nonogram.core.Clue;
import us.blanshard.nonogram.core.Color;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Palette;
import us.blanshard.nonogram.core.Run;

import com.google.common.collect.Lists;
import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Static methods that convert candidates and puzzles to and from json.
 *
 * <p> A candidate looks like {@code {"name": "fox", "palette": ["#c04010"],
 * "grid": [".11.", "1111"]}}.  An exported puzzle uses the compact form the
 * game reads: {@code t} title, {@code w} and {@code h} dimensions, {@code r}
 * and {@code c} row and column clues as [count, color] pairs, {@code p} the
 * palette, {@code s} the solution, {@code d} the difficulty tier and {@code q}
 * the quality grade.  In the exported form colors count from zero, and the
 * solution marks empty cells with -1.
 *
 * @author Luke Blanshard
 */
public class PuzzleJson {

  /** A Type to use with {@link Gson} for lists of puzzles. */
  @SuppressWarnings("serial")
  public static final Type PUZZLES_TYPE = new TypeToken<List<Puzzle>>(){}.getType();

  /** A convenience for reading candidates and writing puzzles. */
  public static final Gson GSON = registerAll(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that candidates can be
   * serialized and deserialized, and puzzles serialized.
   */
  public static GsonBuilder registerAll(GsonBuilder builder) {
    builder.registerTypeAdapter(Candidate.class, new TypeAdapter<Candidate>() {
      @Override public void write(JsonWriter out, Candidate value) throws IOException {
        out.beginObject();
        out.name("name").value(value.name);
        out.name("palette").beginArray();
        for (Color color : value.palette)
          out.value(color.toHex());
        out.endArray();
        out.name("grid").beginArray();
        for (String row : value.grid.toString().split("\n"))
          if (!row.isEmpty()) out.value(row);
        out.endArray();
        out.endObject();
      }

      @Override public Candidate read(JsonReader in) throws IOException {
        String name = null;
        List<String> colors = null;
        List<String> rows = null;
        in.beginObject();
        while (in.hasNext()) {
          String key = in.nextName();
          if (key.equals("name")) {
            name = in.nextString();
          } else if (key.equals("palette")) {
            colors = Lists.newArrayList();
            in.beginArray();
            while (in.hasNext())
              colors.add(in.nextString());
            in.endArray();
          } else if (key.equals("grid")) {
            rows = Lists.newArrayList();
            in.beginArray();
            while (in.hasNext())
              rows.add(in.nextString());
            in.endArray();
          } else {
            in.skipValue();
          }
        }
        in.endObject();
        if (name == null || colors == null || rows == null)
          throw new JsonParseException("Candidate needs name, palette and grid");
        try {
          Palette palette = Palette.fromHex(colors.toArray(new String[colors.size()]));
          return Candidate.of(name, Grid.fromRows(rows), palette);
        } catch (IllegalArgumentException e) {
          throw new JsonParseException("Bad candidate " + name + ": " + e.getMessage(), e);
        }
      }
    });

    builder.registerTypeAdapter(Puzzle.class, new JsonSerializer<Puzzle>() {
      @Override public JsonElement serialize(Puzzle src, Type typeOfSrc,
          JsonSerializationContext context) {
        return toJsonObject(src);
      }
    });
    return builder;
  }

  /**
   * One element of a candidate file: either the candidate, or the reason it
   * couldn't be read.
   */
  @Immutable
  public static final class Entry {
    public final String name;
    @Nullable public final Candidate candidate;
    @Nullable public final String error;

    private Entry(String name, @Nullable Candidate candidate, @Nullable String error) {
      this.name = name;
      this.candidate = candidate;
      this.error = error;
    }

    public static Entry of(Candidate candidate) {
      return new Entry(candidate.name, candidate, null);
    }

    public static Entry unreadable(String name, String error) {
      return new Entry(name, null, error);
    }

    public boolean isReadable() {
      return candidate != null;
    }

    @Override public String toString() {
      return candidate != null ? candidate.toString() : name + ": " + error;
    }
  }

  /**
   * Reads a json array of candidates.  Each element is decoded on its own, so
   * a malformed candidate turns into an unreadable entry in its place rather
   * than spoiling the whole array.
   *
   * @throws JsonParseException if the text isn't a json array
   */
  public static List<Entry> readEntries(Reader reader) {
    JsonElement root = JsonParser.parseReader(reader);
    if (!root.isJsonArray()) throw new JsonParseException("Expected an array of candidates");
    List<Entry> entries = Lists.newArrayList();
    for (JsonElement element : root.getAsJsonArray()) {
      String name = nameOf(element, entries.size());
      try {
        Candidate candidate = GSON.fromJson(element, Candidate.class);
        if (candidate == null) throw new JsonParseException("Null candidate");
        entries.add(Entry.of(candidate));
      } catch (JsonParseException e) {
        entries.add(Entry.unreadable(name, e.getMessage()));
      }
    }
    return entries;
  }

  private static String nameOf(JsonElement element, int index) {
    if (element.isJsonObject()) {
      JsonElement name = element.getAsJsonObject().get("name");
      if (name != null && name.isJsonPrimitive()) return name.getAsString();
    }
    return "#" + (index + 1);
  }

  public static String toJson(List<Puzzle> puzzles) {
    return GSON.toJson(puzzles, PUZZLES_TYPE);
  }

  /** Builds the exported form of a puzzle. */
  public static JsonObject toJsonObject(Puzzle puzzle) {
    JsonObject object = new JsonObject();
    object.addProperty("t", puzzle.title());
    object.addProperty("w", puzzle.width());
    object.addProperty("h", puzzle.height());
    object.add("r", fromClues(puzzle.nonogram.rowClues()));
    object.add("c", fromClues(puzzle.nonogram.columnClues()));
    JsonArray palette = new JsonArray();
    for (Color color : puzzle.nonogram.palette())
      palette.add(new JsonPrimitive(color.toHex()));
    object.add("p", palette);
    JsonArray solution = new JsonArray();
    for (int r = 0; r < puzzle.height(); ++r) {
      JsonArray row = new JsonArray();
      for (int c = 0; c < puzzle.width(); ++c)
        row.add(new JsonPrimitive(puzzle.solution.get(r, c) - 1));
      solution.add(row);
    }
    object.add("s", solution);
    object.addProperty("d", puzzle.difficulty().code());
    object.addProperty("q", puzzle.quality.grade.code());
    return object;
  }

  private static JsonArray fromClues(List<Clue> clues) {
    JsonArray lines = new JsonArray();
    for (Clue clue : clues) {
      JsonArray line = new JsonArray();
      for (Run run : clue) {
        JsonArray pair = new JsonArray();
        pair.add(new JsonPrimitive(run.length));
        pair.add(new JsonPrimitive(run.color - 1));
        line.add(pair);
      }
      lines.add(line);
    }
    return lines;
  }

  // Static methods only.
  private PuzzleJson() {}
}
