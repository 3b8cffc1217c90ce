package courier;

/**
 * Releases the resources held by a message's payload. Runs at most once, from
 * {@link Message#destroy()}.
 */
@FunctionalInterface
public interface PayloadReleaser {

  void release(Object payload);
}
