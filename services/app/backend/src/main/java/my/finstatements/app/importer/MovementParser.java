package my.finstatements.app.importer;

import my.finstatements.app.domain.MovementTable;

public interface MovementParser {
	MovementTable parse(byte[] payload, String filename);
}
