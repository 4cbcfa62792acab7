/*
 * Copyright 2025 The AstView Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.astview.adapter;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import groovy.util.ConfigSlurper;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * An immutable map from the fully-qualified class name of an AST node to the template used to
 * render that node's label.
 *
 * <p>Mapping files are Groovy {@link ConfigSlurper} scripts whose flattened keys are class names.
 * Package segments must be written as nested blocks, e.g.
 *
 * <pre>
 * org { codehaus { groovy { ast { expr {
 *   VariableExpression = 'Variable - $expression.name'
 * } } } } }
 * </pre>
 *
 * <p>The {@link #standard} table is built once per process from the bundled defaults, overlaid by
 * the user's own file (see {@link #userFile}); it is never reloaded.
 */
public final class LabelMappingTable {
  private static final Logger logger = Logger.getLogger(LabelMappingTable.class.getName());

  /** The classpath resource holding the bundled default templates. */
  static final String DEFAULTS_RESOURCE = "AstBrowserProperties.groovy";

  /** If set, the path of the user's mapping file; otherwise {@link #userFile} uses the default. */
  public static final String USER_FILE_PROPERTY = "astview.userLabels";

  private static final LabelMappingTable EMPTY = new LabelMappingTable(ImmutableMap.of());

  private final ImmutableMap<String, String> templates;

  private LabelMappingTable(ImmutableMap<String, String> templates) {
    this.templates = templates;
  }

  /** Returns a table with no entries; every node gets its class's simple name as a label. */
  public static LabelMappingTable empty() {
    return EMPTY;
  }

  /** Returns a table with exactly the given entries. */
  public static LabelMappingTable of(Map<String, String> templates) {
    return new LabelMappingTable(ImmutableMap.copyOf(templates));
  }

  /** Returns the process-wide table, loading it on first use. */
  public static LabelMappingTable standard() {
    return StandardHolder.INSTANCE;
  }

  /** Initialization-on-demand holder for {@link #standard}. */
  private static class StandardHolder {
    static final LabelMappingTable INSTANCE = loadStandard();
  }

  private static LabelMappingTable loadStandard() {
    URL defaults = LabelMappingTable.class.getResource(DEFAULTS_RESOURCE);
    if (defaults == null) {
      throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
    }
    return load(defaults, userFile());
  }

  /**
   * Returns the location of the user's mapping file: the value of the {@value #USER_FILE_PROPERTY}
   * system property if set, otherwise {@code ~/.groovy/AstBrowserProperties.groovy}. Returns null
   * if neither is available.
   */
  @VisibleForTesting
  static @Nullable Path userFile() {
    String override = System.getProperty(USER_FILE_PROPERTY);
    if (override != null && !override.isEmpty()) {
      return Path.of(override);
    }
    String home = System.getProperty("user.home");
    if (home == null || home.isEmpty()) {
      return null;
    }
    return Path.of(home, ".groovy", DEFAULTS_RESOURCE);
  }

  /**
   * Loads the templates in {@code defaults}, then overlays those in {@code overrides} if that file
   * exists. Entries from {@code overrides} replace defaults with the same key.
   *
   * <p>A defaults file that cannot be parsed is an error; an overrides file that cannot be parsed is
   * logged and ignored.
   */
  public static LabelMappingTable load(URL defaults, @Nullable Path overrides) {
    checkNotNull(defaults);
    Map<String, String> merged = new LinkedHashMap<>(parse(defaults));
    if (overrides != null && Files.isRegularFile(overrides)) {
      try {
        merged.putAll(parse(overrides.toUri().toURL()));
      } catch (MalformedURLException | RuntimeException e) {
        logger.log(Level.WARNING, "Ignoring unreadable label mappings in " + overrides, e);
      }
    }
    logger.config(() -> String.format("Loaded %s label mappings from %s", merged.size(), defaults));
    return new LabelMappingTable(ImmutableMap.copyOf(merged));
  }

  private static Map<String, String> parse(URL url) {
    Properties props = new ConfigSlurper().parse(url).toProperties();
    Map<String, String> result = new LinkedHashMap<>();
    for (String key : props.stringPropertyNames()) {
      result.put(key, props.getProperty(key));
    }
    return result;
  }

  /** Returns the template for nodes whose class has the given name, or null if there is none. */
  public @Nullable String template(String className) {
    return templates.get(className);
  }

  public ImmutableMap<String, String> asMap() {
    return templates;
  }

  public int size() {
    return templates.size();
  }

  @Override
  public String toString() {
    return "LabelMappingTable" + templates.keySet();
  }
}
