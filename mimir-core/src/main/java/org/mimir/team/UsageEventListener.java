package org.mimir.team;

@FunctionalInterface
public interface UsageEventListener {
    void onEvent(UsageEvent event);
}
