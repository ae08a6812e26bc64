package com.mimickv.command;

import com.mimickv.network.protocol.Reply;

import java.util.List;

/**
 * Executes one command.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @param client the calling connection
     * @param args   arguments after the command name
     * @return the reply, or null when the client disconnected while blocked and
     *         nothing must be sent
     * @throws com.mimickv.core.CommandException to answer with an error
     */
    Reply handle(ClientContext client, List<String> args);
}
