package com.adlens.report;

import java.nio.file.Path;

/** Files written for one run. */
public record RunArtifacts(Path insights, Path creatives, Path report, Path metadata) {
}
