/**
 * Runs pipeline steps: resolves each sub step's implementer by name and threads the workflow
 * result ledger between consecutive invocations.
 */
package com.tssc.runner;
