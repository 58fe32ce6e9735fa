package org.javai.mathtex.ast;

/**
 * Visitor over the closed set of {@link MathNode} variants.
 *
 * Implementations such as the LaTeX emitter must handle every variant, which turns
 * "was every node kind handled" into a compile-time check.
 *
 * @param <R> the return type of the visitor operations
 */
public interface MathNodeVisitor<R> {

	R visitRun(MathNode.Run run);

	R visitGroup(MathNode.Group group);

	R visitFraction(MathNode.Fraction fraction);

	R visitRadical(MathNode.Radical radical);

	R visitSuperscript(MathNode.Superscript superscript);

	R visitSubscript(MathNode.Subscript subscript);

	R visitSubSup(MathNode.SubSup subSup);

	R visitPreSubSup(MathNode.PreSubSup preSubSup);

	R visitNaryOperator(MathNode.NaryOperator nary);

	R visitDelimited(MathNode.Delimited delimited);

	R visitMatrix(MathNode.Matrix matrix);

	R visitAccent(MathNode.Accent accent);

	R visitLimitExpr(MathNode.LimitExpr limitExpr);

	R visitFunctionApply(MathNode.FunctionApply functionApply);

	R visitEquationArray(MathNode.EquationArray equationArray);

	R visitEnclosed(MathNode.Enclosed enclosed);

	R visitDegradedText(MathNode.DegradedText degradedText);
}
