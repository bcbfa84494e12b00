/**
 * Translation of exceptions into HTTP error responses.
 */
package com.phillippitts.modelelector.presentation.exception;
