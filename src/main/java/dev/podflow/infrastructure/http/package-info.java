/**
 * HTTP and JSON plumbing shared by the remote adapters.
 */
package dev.podflow.infrastructure.http;
