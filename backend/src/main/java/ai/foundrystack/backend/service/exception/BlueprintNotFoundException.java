package ai.foundrystack.backend.service.exception;

public class BlueprintNotFoundException extends RuntimeException {

    public BlueprintNotFoundException(String blueprintId) {
        super("Blueprint " + blueprintId + " not found");
    }
}
