package syndicator.model;

public enum JobAction {
  PUBLISH,
  DELETE
}
