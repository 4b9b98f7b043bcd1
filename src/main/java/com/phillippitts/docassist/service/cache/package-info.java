/**
 * Result caching. Summaries are cached per source so repeat requests skip the model.
 */
package com.phillippitts.docassist.service.cache;
