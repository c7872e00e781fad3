package io.intellixity.entigen.codegen;

import java.util.List;

/**
 * Provenance of one codegen run: every artifact with its content hash.\n
 *
 * Contains no timestamps so identical inputs produce an identical manifest.
 */
public record GenerationManifest(String generator, List<Artifact> artifacts) {
  public static final String GENERATOR = "entigen";

  public record Artifact(String path, String kind, String entity, String sha256) {}

  public GenerationManifest {
    artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
  }
}
