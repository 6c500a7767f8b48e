/**
 * Validating conversion from the adapter IR into the analysis IR.
 * <p>
 * The entry points are {@link io.github.libra.core.passes.convert.AdapterToIr} for a single
 * translation unit and {@link io.github.libra.core.passes.convert.LinkModules} for several.
 */
package io.github.libra.core.passes.convert;
