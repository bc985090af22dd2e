package org.stmtflow.cfg;

import com.github.javaparser.ast.stmt.Statement;

import java.util.Optional;

/**
 * 语句分类器。只认识五种语句，其它一律返回空，由调用方跳过。
 */
public final class StmtClassifier {

    private StmtClassifier() {
    }

    public static Optional<StmtKind> classify(Statement s) {
        if (s.isExpressionStmt()) {
            return Optional.of(StmtKind.EXPRESSION);
        } else if (s.isReturnStmt()) {
            return Optional.of(StmtKind.RETURN);
        } else if (s.isIfStmt()) {
            return Optional.of(StmtKind.CONDITIONAL);
        } else if (s.isForStmt()) {
            return Optional.of(StmtKind.COUNTED_LOOP);
        } else if (s.isForEachStmt()) {
            return Optional.of(StmtKind.ITERATION_LOOP);
        }
        // while / do / switch / try / 标签语句 / break / continue / throw 等
        return Optional.empty();
    }
}
