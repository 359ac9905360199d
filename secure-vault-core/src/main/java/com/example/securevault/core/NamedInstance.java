package com.example.securevault.core;

/** A component that can be looked up by name when several instances are registered. */
public interface NamedInstance {

  /**
   * @return lookup name of this instance
   */
  String getName();
}
