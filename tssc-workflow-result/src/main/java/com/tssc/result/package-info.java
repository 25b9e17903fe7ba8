/**
 * Step results and the workflow result ledger shared by sequential step invocations.
 * {@link com.tssc.result.StepResult} is the outcome of one step; {@link com.tssc.result.WorkflowResult}
 * is the append-only ledger persisted as a binary snapshot and a YAML results file.
 */
package com.tssc.result;
