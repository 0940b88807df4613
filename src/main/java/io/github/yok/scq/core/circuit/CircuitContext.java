package io.github.yok.scq.core.circuit;

import io.github.yok.scq.core.basis.BasisOperatorFactory;
import io.github.yok.scq.core.dispatch.CentralDispatch;
import io.github.yok.scq.core.linearalgebra.EigenDecompositionBackend;
import lombok.Value;

/**
 * ルート回路が所有し、サブシステムへ引き渡す共有部品です。
 */
@Value
class CircuitContext {

    CentralDispatch dispatch;

    CircuitOptions options;

    EigenDecompositionBackend eigenBackend;

    BasisOperatorFactory basisFactory;
}
