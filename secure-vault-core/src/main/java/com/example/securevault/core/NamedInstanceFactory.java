package com.example.securevault.core;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves one of several registered instances by name.
 *
 * <p>Instances are read from the supplier on every lookup, so instances registered after the
 * factory was created are still found. When two instances share a name the first one supplied
 * wins.
 *
 * @param <T> instance type
 */
public class NamedInstanceFactory<T extends NamedInstance> {

  private final Supplier<? extends Collection<? extends T>> instances;

  public NamedInstanceFactory(final Supplier<? extends Collection<? extends T>> instances) {
    this.instances = Objects.requireNonNull(instances, "instances");
  }

  /**
   * Finds the instance registered under {@code name}.
   *
   * @param name lookup name
   * @return the matching instance, or empty when none matches
   */
  public Optional<T> find(final String name) {
    return instances.get().stream()
        .filter(instance -> Objects.equals(instance.getName(), name))
        .<T>map(instance -> instance)
        .findFirst();
  }

  /**
   * Returns the instance registered under {@code name}.
   *
   * @param name lookup name
   * @return the matching instance
   * @throws NoSuchElementException when no instance has that name
   */
  public T get(final String name) {
    return find(name)
        .orElseThrow(() -> new NoSuchElementException("No instance named '%s'".formatted(name)));
  }

  /**
   * @return names of all currently available instances, in registration order
   */
  public Set<String> names() {
    final var names = new LinkedHashSet<String>();
    instances.get().forEach(instance -> names.add(instance.getName()));
    return names;
  }
}
