/**
 * Implementers of the {@code validate-environment-configuration} step.
 */
package com.tssc.stepimplementers.validateenvironmentconfiguration;
