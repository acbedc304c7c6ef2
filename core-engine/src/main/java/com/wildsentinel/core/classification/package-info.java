/**
 * False-positive scoring, filter decisions and severity assignment.
 */
package com.wildsentinel.core.classification;
