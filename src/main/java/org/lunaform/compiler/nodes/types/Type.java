package org.lunaform.compiler.nodes.types;

/**
 * A Luau type annotation.
 * <p>
 * A type is also accepted wherever a return type, a type parameter or the type of {@code ...}
 * is expected, hence the extended interfaces.
 */
public interface Type extends FunctionReturnType, TypeParameter, FunctionVariadicType {
}
