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

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * What became of one candidate: an accepted puzzle, a rejection, or an error
 * if processing it failed unexpectedly.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Outcome {

  public enum Kind { ACCEPTED, REJECTED, ERROR }

  public final String name;
  public final Kind kind;
  @Nullable public final Puzzle puzzle;
  @Nullable public final Rejection rejection;
  @Nullable public final String error;
  public final long elapsedMillis;

  private Outcome(String name, Kind kind, @Nullable Puzzle puzzle, @Nullable Rejection rejection,
      @Nullable String error, long elapsedMillis) {
    this.name = checkNotNull(name);
    this.kind = kind;
    this.puzzle = puzzle;
    this.rejection = rejection;
    this.error = error;
    this.elapsedMillis = elapsedMillis;
  }

  public static Outcome accepted(Puzzle puzzle, long elapsedMillis) {
    return new Outcome(puzzle.name, Kind.ACCEPTED, puzzle, null, null, elapsedMillis);
  }

  public static Outcome rejected(String name, Rejection rejection, long elapsedMillis) {
    return new Outcome(name, Kind.REJECTED, null, checkNotNull(rejection), null, elapsedMillis);
  }

  public static Outcome error(String name, String error, long elapsedMillis) {
    return new Outcome(name, Kind.ERROR, null, null, checkNotNull(error), elapsedMillis);
  }

  public boolean isAccepted() {
    return kind == Kind.ACCEPTED;
  }

  @Override public String toString() {
    switch (kind) {
      case ACCEPTED: return name + ": accepted as " + puzzle;
      case REJECTED: return name + ": rejected, " + rejection;
      default:       return name + ": error, " + error;
    }
  }
}
