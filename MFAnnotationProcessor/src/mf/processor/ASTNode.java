package mf.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a syntax tree class. The processor generates a {@code <Outer>_<Name>_ASTNode} interface
 * for it, which the class must implement, and adds a visit method for it to the generated
 * visitors.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
