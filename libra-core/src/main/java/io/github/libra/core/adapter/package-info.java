/**
 * The adapter IR: a plain tree of records, as deserialized from the interchange form
 * emitted by the compiler front end.
 * <p>
 * Nothing in this package is validated; see {@link io.github.libra.core.passes.convert.AdapterToIr}
 * for the conversion into the checked IR of {@link io.github.libra.core.ir}.
 */
package io.github.libra.core.adapter;
