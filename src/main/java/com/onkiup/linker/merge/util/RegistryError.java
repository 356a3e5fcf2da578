package com.onkiup.linker.merge.util;

import com.onkiup.linker.merge.registry.UtilityGroup;

/**
 * Thrown when declarative group data is inconsistent
 */
public class RegistryError extends RuntimeException {

  private final UtilityGroup source;

  public RegistryError(String msg, UtilityGroup source) {
    super(msg);
    this.source = source;
  }

  public RegistryError(String msg, UtilityGroup source, Throwable cause) {
    super(msg, cause);
    this.source = source;
  }

  public UtilityGroup source() {
    return source;
  }

  @Override
  public String toString() {
    return new StringBuilder("Registry error at group ")
      .append(source == null ? "<unknown>" : source.id())
      .append(": ")
      .append(getMessage())
      .toString();
  }
}
