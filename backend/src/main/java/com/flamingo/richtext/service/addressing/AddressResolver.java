package com.flamingo.richtext.service.addressing;

import com.flamingo.richtext.domain.model.RichDocument;
import com.flamingo.richtext.domain.model.Run;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Binds opaque stable addresses to runs.
 *
 * <p>Keeps a forward index (address to run) and an identity-keyed reverse index (run to address).
 * Both indexes are updated together by every bind/unbind, so a run holds at most one address and an
 * address names at most one run. A run may be unaddressed.
 *
 * <p>Not thread-safe; the owning editor session serializes access.
 */
@Slf4j
public class AddressResolver {

  static final String ADDRESS_PREFIX = "Run_";

  private final Map<String, Run> runsByAddress = new HashMap<>();
  private final Map<Run, String> addressesByRun = new IdentityHashMap<>();

  /** Returns the run currently bound to {@code address}. */
  public Optional<Run> resolve(String address) {
    if (address == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(runsByAddress.get(address));
  }

  /**
   * Binds {@code address} to {@code run}.
   *
   * @throws IllegalStateException if the address is already bound to a different run
   */
  public void bind(Run run, String address) {
    Run existing = runsByAddress.get(address);
    if (existing != null && existing != run) {
      throw new IllegalStateException("Address already bound: " + address);
    }
    String previous = addressesByRun.put(run, address);
    if (previous != null && !previous.equals(address)) {
      runsByAddress.remove(previous);
    }
    runsByAddress.put(address, run);
  }

  /** Mints a fresh address, binds it to {@code run} and returns it. */
  public String bindFresh(Run run) {
    String address = mint();
    bind(run, address);
    return address;
  }

  /** Removes the binding for {@code address}; the run it named becomes unaddressed. */
  public void unbind(String address) {
    Run run = runsByAddress.remove(address);
    if (run != null) {
      addressesByRun.remove(run);
    }
  }

  /** Removes whatever address {@code run} holds. */
  public void unbindRun(Run run) {
    String address = addressesByRun.remove(run);
    if (address != null) {
      runsByAddress.remove(address);
    }
  }

  public Optional<String> addressOf(Run run) {
    return Optional.ofNullable(addressesByRun.get(run));
  }

  /** Returns the run's address, binding a fresh one first if the run has none. */
  public String ensureAddress(Run run) {
    String existing = addressesByRun.get(run);
    return existing != null ? existing : bindFresh(run);
  }

  /**
   * Drops every binding and gives each run in {@code document} a freshly minted address. Used after
   * a load, where any identifiers in the source material are discarded.
   */
  public void rebindAll(RichDocument document) {
    clear();
    document.runs().forEach(this::bindFresh);
    log.debug("Bound {} runs to fresh addresses", runsByAddress.size());
  }

  public void clear() {
    runsByAddress.clear();
    addressesByRun.clear();
  }

  public int size() {
    return runsByAddress.size();
  }

  /** Mints an address that has never been handed out. */
  public String mint() {
    String address;
    do {
      address = ADDRESS_PREFIX + UUID.randomUUID().toString().replace("-", "");
    } while (runsByAddress.containsKey(address));
    return address;
  }
}
