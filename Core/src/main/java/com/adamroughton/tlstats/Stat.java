/*
 * Copyright 2013 Adam Roughton
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
package com.adamroughton.tlstats;

import java.io.Closeable;
import java.util.Objects;

import com.adamroughton.tlstats.policy.ConcurrencyPolicy;
import com.adamroughton.tlstats.policy.ContainerAndLock;
import com.esotericsoftware.minlog.Log;

/**
 * Base class for the local stats held by a {@link StatContainer}.
 * <p>
 * A stat is only visible to {@link StatContainer#aggregate()} while it is registered.
 * Subclasses must call {@link #postInit(StatContainer)} as the very last step of
 * creating a stat, once all of their state is initialised, so that no partially
 * built stat can be aggregated. {@link #close()} detaches the stat before anything
 * else happens to it.
 * <p>
 * Stats cannot be copied. Subclasses may support moving their state into a new
 * instance (through {@link #Stat(Stat)} and {@link #finishMove(Stat)}) or into an
 * existing instance (through {@link #moveAssignment(Stat, MoveContents)}); both 
 * keep the registration consistent so that no sample is lost or counted twice.
 * 
 * @author Adam Roughton
 *
 */
public abstract class Stat implements Closeable {

	private final ConcurrencyPolicy _policy;
	private final ContainerAndLock<StatContainer> _containerAndLock;
	
	// only changed by moveAssignment
	private volatile String _name;
	
	protected Stat(StatContainer container, String name) {
		_policy = container.getPolicy();
		_containerAndLock = _policy.newContainerAndLock();
		_name = Objects.requireNonNull(name);
	}
	
	/**
	 * Starts moving {@code other} into a new stat. The subclass takes over the
	 * state of {@code other} and must then call {@link #finishMove(Stat)} as the
	 * last step.
	 * <p>
	 * The registration is handed over in a single step by {@link #finishMove(Stat)},
	 * after which {@code other} is unregistered. If the subclass fails after taking 
	 * the state of {@code other} but before finishing the move, {@code other} stays 
	 * registered but its taken state is lost.
	 */
	protected Stat(Stat other) {
		_policy = other._policy;
		_containerAndLock = _policy.newContainerAndLock();
		_name = other._name;
	}
	
	public final String getName() {
		return _name;
	}
	
	/**
	 * Gets the container this stat is registered with.
	 * @return the container, or {@code null} if the stat is orphaned or closed
	 */
	public final StatContainer getContainer() {
		return _containerAndLock.get();
	}
	
	public final boolean isRegistered() {
		return getContainer() != null;
	}
	
	/**
	 * Publishes the data accumulated since the last aggregation to the sink of the
	 * container, and resets the local state. Does nothing if the stat is not registered.
	 * @param nowSeconds the aggregation time in seconds
	 */
	public abstract void aggregate(long nowSeconds);
	
	/**
	 * Aggregates this stat using the time of the container's clock. Does nothing
	 * if the stat is not registered.
	 */
	public final void aggregate() {
		StatContainer container = getContainer();
		if (container != null) {
			aggregate(container.currentTimeSeconds());
		}
	}
	
	/**
	 * Flushes any pending data and unregisters this stat. The stat can still be
	 * updated afterwards, but the updates will never be published. Closing an
	 * unregistered stat has no effect.
	 */
	@Override
	public final void close() {
		StatContainer container = detach();
		if (container != null && Log.DEBUG) {
			Log.debug(String.format("Closed stat '%s'", _name));
		}
	}
	
	protected final ConcurrencyPolicy getPolicy() {
		return _policy;
	}
	
	/**
	 * Acquires the guard over this stat's local state.
	 */
	protected final void lockStat() {
		_containerAndLock.lock();
	}
	
	protected final void unlockStat() {
		_containerAndLock.unlock();
	}
	
	/**
	 * Verifies that this stat is registered and returns its container.
	 * @param action a description of the operation requiring the container
	 * @throws IllegalStateException if the stat is not registered
	 */
	protected final StatContainer checkContainer(String action) {
		StatContainer container = getContainer();
		if (container == null)
			throw new IllegalStateException(String.format("Error %s for the stat '%s': the stat is not registered with a stats container.", 
					action, _name));
		return container;
	}
	
	/**
	 * Registers this stat with the container. Must be the last step of construction.
	 */
	protected final void postInit(StatContainer container) {
		checkSamePolicy(container.getPolicy(), "be registered with a container using");
		if (isRegistered())
			throw new IllegalStateException(String.format("The stat '%s' is already registered.", _name));
		container.register(this);
	}
	
	/**
	 * Replaces {@code other} with this stat in the container of {@code other}. Must
	 * be the last step of a move constructor. If {@code other} is not registered, 
	 * this stat stays unregistered.
	 */
	protected final void finishMove(Stat other) {
		StatContainer container = other.getContainer();
		if (container == null) return;
		if (!container.replace(other, this)) {
			Log.warn(String.format("The stat '%s' was unregistered while being moved; the moved stat will not be aggregated.", _name));
		}
	}
	
	/**
	 * Moves {@code other} into this stat:
	 * <ol>
	 * <li>does nothing if {@code other} is this stat;</li>
	 * <li>aggregates this stat and unregisters it;</li>
	 * <li>aggregates {@code other} and unregisters it;</li>
	 * <li>runs {@code moveContents} to take over the local state of {@code other};</li>
	 * <li>registers this stat with the former container of {@code other}.</li>
	 * </ol>
	 * No other thread may access either stat during the move. Both stats must use
	 * the same kind of {@link ConcurrencyPolicy}; otherwise an {@link IllegalArgumentException}
	 * is thrown before either stat is changed.
	 */
	protected final void moveAssignment(Stat other, MoveContents moveContents) {
		if (other == this) return;
		checkSamePolicy(other._policy, "move from a stat using");
		StatContainer otherContainer = other.getContainer();
		if (otherContainer != null) {
			checkSamePolicy(otherContainer.getPolicy(), "be registered with a container using");
		}
		detach();
		StatContainer container = other.detach();
		moveContents.moveContents();
		_name = other._name;
		if (container != null) {
			postInit(container);
		}
	}
	
	/**
	 * The guard and cells of a stat are created by its policy, so a stat can only
	 * be registered with containers using the same kind of policy.
	 */
	private void checkSamePolicy(ConcurrencyPolicy policy, String action) {
		if (policy.getClass() != _policy.getClass())
			throw new IllegalArgumentException(String.format("The stat '%s' uses the policy %s and cannot %s %s", 
					_name, _policy, action, policy));
	}
	
	/**
	 * Aggregates any pending data and unregisters the stat.
	 * @return the container the stat was registered with, or {@code null}
	 */
	final StatContainer detach() {
		StatContainer container = getContainer();
		if (container == null) return null;
		aggregate(container.currentTimeSeconds());
		if (!container.unregister(this) && Log.WARN) {
			Log.warn(String.format("The stat '%s' was already unregistered from its container.", _name));
		}
		return container;
	}
	
	/**
	 * Called by the container with its main lock held.
	 */
	final void setContainer(StatContainer container) {
		_containerAndLock.lock();
		try {
			_containerAndLock.set(container);
		} finally {
			_containerAndLock.unlock();
		}
	}
	
	protected interface MoveContents {
		void moveContents();
	}
	
}
