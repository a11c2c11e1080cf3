package com.architecture.memory.codegraph.service.graph.parser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A call site as found in source code, before it is matched to a method entity.
 *
 * Example: this.paymentService.process(order)
 *   - calleeName = "process"
 *   - arity = 1
 *   - receiverKind = NAMED, receiverType = "PaymentService" when the receiver type is known
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawCall {

    public enum ReceiverKind {
        // bare call: foo()
        NONE,
        // this.foo(), self.foo() or an implicit this
        SELF,
        // receiver with a known type name: Type.foo(), typedVar.foo()
        NAMED,
        // receiver of unknown type: x.foo()
        UNKNOWN
    }

    private String callerId;

    // Type (or file, for top-level functions) that declares the caller
    private String callerOwnerId;

    private String calleeName;

    // Number of arguments at the call site, -1 if unknown
    @Builder.Default
    private int arity = -1;

    @Builder.Default
    private ReceiverKind receiverKind = ReceiverKind.NONE;

    // Simple or qualified type name, NAMED receivers only
    private String receiverType;

    // Whether a bare call may target a member of the caller's own type
    private boolean implicitSelf;

    private int line;
}
