package com.cbinding.generator.codegen.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Tool-wide diagnostics (warnings/info) accumulated during a translation run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasWarnings() {
	  return !warnings.isEmpty();
  }

}
