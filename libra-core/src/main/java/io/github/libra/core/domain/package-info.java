/**
 * The lattice contract used by the fixed-point engine, and generic combinators
 * for building new domains out of existing ones.
 *
 * @see io.github.libra.core.domain.AbstractDomain
 */
package io.github.libra.core.domain;
