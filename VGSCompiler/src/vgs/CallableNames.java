package vgs;

import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CallableNames {
  private static final Logger log = LoggerFactory.getLogger(CallableNames.class);

  private final Set<String> taken = new HashSet<>();

  public String claim(String base) {
    if (taken.add(base)) {
      return base;
    }

    int suffix = 2;
    while (!taken.add(base + "_" + suffix)) {
      suffix++;
    }
    String name = base + "_" + suffix;
    log.warn("Function name '{}' is already used; renamed to '{}'", base, name);
    return name;
  }
}
