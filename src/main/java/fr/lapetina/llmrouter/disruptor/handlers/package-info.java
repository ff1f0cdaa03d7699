/**
 * Event handlers of the request intake pipeline.
 *
 * <p>Events flow through handlers in sequence, each stage skipping events an earlier stage
 * already answered:
 * <pre>
 * Validation → Cache Lookup → Admission → Budget → Dispatch → Metrics → Completion
 * </pre>
 *
 * <p>Dispatch is asynchronous: the handler copies what it needs out of the event and returns,
 * and the caller's future is completed from the provider call's callback. Cache hits and
 * rejections are completed by the last stage, which also recycles the event.
 *
 * @see fr.lapetina.llmrouter.LoadBalancer
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.llmrouter.disruptor.handlers;
