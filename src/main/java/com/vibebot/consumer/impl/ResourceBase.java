// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.vibebot.consumer.impl;

import static com.vibebot.consumer.Resource.State.CLOSED;
import static com.vibebot.consumer.Resource.State.DISCONNECTED;

import com.vibebot.consumer.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle state of a consumer, published to state listeners.
 *
 * <p>Transitions are expected on a single thread, the consumer event loop. Listeners run on that
 * thread, in registration order. The cause of the transition to {@link State#CLOSED} is kept as
 * the failure cause of the resource.
 */
abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>(DISCONNECTED);
  private final List<StateListener> listeners;
  private volatile Throwable failureCause;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
  }

  public State state() {
    return this.state.get();
  }

  public Throwable failureCause() {
    return this.failureCause;
  }

  protected void state(State state) {
    this.state(state, null);
  }

  protected void state(State state, Throwable cause) {
    if (state == CLOSED) {
      this.failureCause = cause;
    }
    State previous = this.state.getAndSet(state);
    if (state != previous) {
      LOGGER.debug("{} {} -> {}", this, previous, state);
      if (!this.listeners.isEmpty()) {
        Transition transition = new Transition(this, cause, previous, state);
        for (StateListener listener : this.listeners) {
          try {
            listener.handle(transition);
          } catch (Exception e) {
            LOGGER.warn("Error in state listener of {} on {} -> {}", this, previous, state, e);
          }
        }
      }
    }
  }

  private static final class Transition implements Context {

    private final Resource resource;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;

    private Transition(
        Resource resource, Throwable failureCause, State previousState, State currentState) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }

    @Override
    public String toString() {
      return previousState + " -> " + currentState;
    }
  }
}
