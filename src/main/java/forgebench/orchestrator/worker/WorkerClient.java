package forgebench.orchestrator.worker;

import forgebench.orchestrator.pool.Endpoint;

import java.time.Duration;

/**
 * Sends one analysis request to one worker endpoint and waits for the reply.
 */
public interface WorkerClient {

    /**
     * Dispatch a request, blocking the calling thread.
     *
     * @param endpoint the selected endpoint
     * @param request  the analysis request
     * @param timeout  overall deadline for connect, send and reply
     * @return the worker's reply, which may itself report an error
     * @throws WorkerDispatchException on transport failure or timeout
     */
    WorkerResponse dispatch(Endpoint endpoint, WorkerRequest request, Duration timeout);
}
